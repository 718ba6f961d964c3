package Engine;

import com.microsoft.z3.Expr;
import com.microsoft.z3.Model;

import java.util.Objects;

public class FirstOrderModel {

    private final RepSet repSet;
    // null when the model was assembled by hand instead of taken from Z3
    private final Model z3Model;

    public FirstOrderModel(RepSet repSet) {
        this(repSet, null);
    }

    public FirstOrderModel(RepSet repSet, Model z3Model) {
        this.repSet = Objects.requireNonNull(repSet, "repSet");
        this.z3Model = z3Model;
    }

    public RepSet getRepSet() {
        return repSet;
    }

    /**
     * Value of t in the underlying Z3 model, completing undefined symbols.
     */
    public Expr getValue(Expr t) {
        if (z3Model == null) {
            throw new IllegalStateException("Model has no Z3 model to evaluate in");
        }
        return z3Model.eval(t, true);
    }
}
