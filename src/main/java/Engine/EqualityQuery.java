package Engine;

import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Quantifier;

import java.util.List;

/**
 * Equality information as seen by quantifier instantiation.
 */
public interface EqualityQuery {

    /**
     * Starts a new round. Choices made in earlier rounds are forgotten.
     */
    boolean reset(Effort e);

    boolean hasTerm(Expr a);

    /**
     * The equality engine's representative of a, or a itself if the engine does not know a.
     */
    Expr getRepresentative(Expr a);

    boolean areEqual(Expr a, Expr b);

    boolean areDisequal(Expr a, Expr b);

    /**
     * Representative of the class of a that is suitable for instantiating the index-th
     * bound variable of q, or for a's own type when q is null.
     */
    Expr getInternalRepresentative(Expr a, Quantifier q, int index);

    /**
     * Appends every member of the class of a to eqc.
     */
    void getEquivalenceClass(Expr a, List<Expr> eqc);

    /**
     * An existing term f(t1..tn) with each ti equal to args[i], or null.
     */
    Expr getCongruentTerm(FuncDecl f, List<Expr> args);
}
