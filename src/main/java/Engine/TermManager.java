package Engine;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Quantifier;
import com.microsoft.z3.Sort;
import com.microsoft.z3.UninterpretedSort;
import utils.Log;

import java.util.Map;
import java.util.Objects;

/**
 * Owns the Z3 context all terms of a session live in, plus the attribute table for them.
 * Everything else in the session only holds references to terms built here.
 */
public class TermManager implements AutoCloseable {

    private final Context ctx;
    private final TermAttributes attributes = new TermAttributes();

    public TermManager() {
        this(new Context(Map.of("model", "true")));
    }

    public TermManager(Context ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    public Context getContext() {
        return ctx;
    }

    public TermAttributes getAttributes() {
        return attributes;
    }

    // Sorts

    public Sort intSort() {
        return ctx.mkIntSort();
    }

    public Sort realSort() {
        return ctx.mkRealSort();
    }

    public Sort boolSort() {
        return ctx.mkBoolSort();
    }

    public UninterpretedSort mkSort(String name) {
        return ctx.mkUninterpretedSort(name);
    }

    // Terms

    public Expr mkConst(String name, Sort sort) {
        return ctx.mkConst(name, sort);
    }

    public FuncDecl mkFunc(String name, Sort range, Sort... domain) {
        return ctx.mkFuncDecl(name, domain, range);
    }

    public Expr mkApp(FuncDecl f, Expr... args) {
        return ctx.mkApp(f, args);
    }

    public Expr mkInt(int value) {
        return ctx.mkInt(value);
    }

    public Expr mkReal(int value) {
        return ctx.mkReal(value);
    }

    public BoolExpr mkEq(Expr a, Expr b) {
        return ctx.mkEq(a, b);
    }

    public Quantifier mkForall(Expr[] boundConstants, BoolExpr body) {
        return ctx.mkForall(boundConstants, body, 0, null, null, null, null);
    }

    /**
     * Builds the {@code index}-th domain element of a finite model for {@code sort} and marks
     * it as an uninterpreted constant.
     */
    public Expr mkUninterpretedConstant(Sort sort, int index) {
        Expr uc = ctx.mkConst("@uc_" + sort + "_" + index, sort);
        attributes.addUninterpretedConstant(uc);
        return uc;
    }

    /**
     * Marks an existing term, e.g. a universe element taken from a Z3 model, as an
     * uninterpreted constant.
     */
    public void registerUninterpretedConstant(Expr value) {
        attributes.addUninterpretedConstant(value);
    }

    /**
     * Builds the instantiation constant standing for the {@code index}-th bound variable of q.
     */
    public Expr mkInstConstant(Quantifier q, int index) {
        Sort[] sorts = q.getBoundVariableSorts();
        if (index < 0 || index >= sorts.length) {
            throw new IndexOutOfBoundsException("Quantifier has " + sorts.length + " bound variables, no index " + index);
        }
        Expr ic = ctx.mkConst("@ic_" + q.getId() + "_" + index, sorts[index]);
        attributes.addInstConstant(ic);
        return ic;
    }

    public void setInstLevel(Expr n, int level) {
        attributes.setInstLevel(n, level);
    }

    @Override
    public void close() {
        Log.debug("Closing Z3 context");
        ctx.close();
    }
}
