package Engine;

import com.microsoft.z3.Expr;

import java.util.Objects;

/**
 * The collaborators representative selection reads from: terms, the active equality
 * engine, the term database and, once built, the finite model.
 */
public class QuantifiersState {

    private final TermManager termManager;
    private final TermDatabase termDatabase;
    private EqualityEngine activeEqualityEngine;
    private FirstOrderModel model;

    public QuantifiersState(TermManager termManager) {
        this.termManager = Objects.requireNonNull(termManager, "termManager");
        this.activeEqualityEngine = new EqualityEngine("master", termManager.getAttributes());
        this.termDatabase = new TermDatabase(this);
    }

    public TermManager getTermManager() {
        return termManager;
    }

    public TermAttributes getAttributes() {
        return termManager.getAttributes();
    }

    public EqualityEngine getActiveEqualityEngine() {
        return activeEqualityEngine;
    }

    public void setActiveEqualityEngine(EqualityEngine ee) {
        this.activeEqualityEngine = Objects.requireNonNull(ee, "ee");
    }

    public TermDatabase getTermDatabase() {
        return termDatabase;
    }

    /**
     * @return the current model, or null if none was built yet
     */
    public FirstOrderModel getModel() {
        return model;
    }

    public void setModel(FirstOrderModel model) {
        this.model = model;
    }

    /**
     * Makes t known to both the equality engine and the term database.
     */
    public void addTerm(Expr t) {
        activeEqualityEngine.addTerm(t);
        termDatabase.registerTerm(t);
    }

    public void assertEquality(Expr a, Expr b) {
        addTerm(a);
        addTerm(b);
        activeEqualityEngine.assertEquality(a, b);
    }
}
