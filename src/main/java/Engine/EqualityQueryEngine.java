package Engine;

import cache.RepScoreLedger;
import cache.RepresentativeCache;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Quantifier;
import com.microsoft.z3.Sort;
import init.QuantOptions;
import init.QuantRepMode;
import utils.Invariant;
import utils.Log;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Answers equality queries for quantifier instantiation and picks internal representatives.
 *
 * <p>An internal representative is the member of an equivalence class that instantiations
 * use in place of the whole class. Candidates are scored (see {@link #getRepScore}):
 * -2 rejects a candidate, -1 accepts it only if nothing better exists, and otherwise the
 * smallest score wins, ties going to the first candidate in class order.
 *
 * <p>Choices are cached per round; {@link #reset(Effort)} must be called before each round
 * since the equality engine may have changed. The round in which a term was first chosen is
 * remembered for the whole session and drives the FIRST mode.
 *
 * <p>Not thread-safe. A session uses one instance from a single thread.
 */
public class EqualityQueryEngine implements EqualityQuery {

    private static final String TRACE_SELECT = "internal-rep-select";
    private static final String TRACE_WARN = "internal-rep-warn";
    private static final String TRACE_DEBUG = "internal-rep-debug";

    private final QuantifiersState state;
    private final QuantOptions options;

    private final RepresentativeCache intRep = new RepresentativeCache();
    private final RepScoreLedger repScore = new RepScoreLedger();
    private int resetCount = 0;

    public EqualityQueryEngine(QuantifiersState state, QuantOptions options) {
        this.state = Objects.requireNonNull(state, "state");
        this.options = Objects.requireNonNull(options, "options");
        Log.debug("Equality query created with " + options);
    }

    @Override
    public boolean reset(Effort e) {
        intRep.clear();
        state.getTermDatabase().reset();
        resetCount++;
        Log.debug("Reset equality query for round " + resetCount + " at effort " + e);
        return true;
    }

    private EqualityEngine getEngine() {
        return state.getActiveEqualityEngine();
    }

    @Override
    public boolean hasTerm(Expr a) {
        return getEngine().hasTerm(a);
    }

    @Override
    public Expr getRepresentative(Expr a) {
        EqualityEngine ee = getEngine();
        if (ee.hasTerm(a)) {
            return ee.getRepresentative(a);
        }
        return a;
    }

    @Override
    public boolean areEqual(Expr a, Expr b) {
        if (a.equals(b)) {
            return true;
        }
        EqualityEngine ee = getEngine();
        if (ee.hasTerm(a) && ee.hasTerm(b)) {
            return ee.areEqual(a, b);
        }
        return false;
    }

    @Override
    public boolean areDisequal(Expr a, Expr b) {
        if (a.equals(b)) {
            return false;
        }
        EqualityEngine ee = getEngine();
        if (ee.hasTerm(a) && ee.hasTerm(b)) {
            return ee.areDisequal(a, b, false);
        }
        TermAttributes attrs = state.getAttributes();
        return TermUtil.isConstValue(attrs, a) && TermUtil.isConstValue(attrs, b);
    }

    @Override
    public Expr getInternalRepresentative(Expr a, Quantifier q, int index) {
        Objects.requireNonNull(a, "a");
        Invariant.check(q == null || q.isUniversal(), () -> "expected a universally quantified formula: " + q);
        Expr r = getRepresentative(a);
        if (options.isFiniteModelFinding()) {
            r = resolveModelValue(r);
        }
        if (options.getRepresentativeMode() == QuantRepMode.EE) {
            return r;
        }

        Sort vTn = getTypeContext(a, q, index);
        Expr cached = intRep.get(vTn, r);
        if (cached != null) {
            return cached;
        }

        List<Expr> eqc = new ArrayList<>();
        getEquivalenceClass(r, eqc);
        Log.trace(TRACE_SELECT, () -> "Choose representative for equivalence class : { "
                + eqc.stream().map(Object::toString).collect(Collectors.joining(", "))
                + " }, type = " + vTn);

        Expr rBest = null;
        int rBestScore = -1;
        for (Expr c : eqc) {
            int score = getRepScore(c, q, index, vTn);
            if (score == -2) {
                continue;
            }
            if (rBest == null || (score >= 0 && (rBestScore < 0 || score < rBestScore))) {
                rBest = c;
                rBestScore = score;
            }
        }
        if (rBest == null) {
            Log.warn(TRACE_WARN, "No valid choice for representative in class of " + r);
            rBest = r;
        }

        // prefer a member of the class found inside the choice over the choice itself
        Expr instance = getInstance(rBest, new HashSet<>(eqc));
        if (instance != null) {
            rBest = instance;
        }

        Expr chosen = rBest;
        // the subterm found above is not rescored, so a class mixing r and to_int(r) fails here
        Invariant.check(TypeUtils.isSubtypeOf(chosen, vTn),
                () -> "internal representative " + chosen + " of sort " + chosen.getSort() + " is not a subtype of " + vTn);
        repScore.recordIfAbsent(chosen, resetCount);
        intRep.put(vTn, r, chosen);

        int bestScore = rBestScore;
        Log.trace(TRACE_SELECT, () -> "...Choose " + chosen + " with score " + bestScore);
        if (!chosen.equals(a)) {
            Log.debug(TRACE_DEBUG, "rep( " + a + " ) = " + r + ", int_rep( " + a + " ) = " + chosen);
        }
        return chosen;
    }

    /**
     * Maps a value assigned by the finite model back to the term it stands for, if any.
     */
    private Expr resolveModelValue(Expr r) {
        TermAttributes attrs = state.getAttributes();
        if (!TermUtil.isConstValue(attrs, r) || !TermUtil.containsUninterpretedConstant(attrs, r)) {
            return r;
        }
        FirstOrderModel model = state.getModel();
        if (model == null) {
            return r;
        }
        Expr tr = model.getRepSet().getTermForRepresentative(r);
        if (tr != null) {
            return getRepresentative(tr);
        }
        Log.warn(TRACE_WARN, "No representative for UF constant " + r);
        // uninterpreted constants must never escape the model
        Invariant.check(!TypeUtils.isUserSort(r.getSort()), () -> "uninterpreted constant " + r + " has no term in the model");
        return r;
    }

    private Sort getTypeContext(Expr a, Quantifier q, int index) {
        if (q == null) {
            return a.getSort();
        }
        Sort[] sorts = q.getBoundVariableSorts();
        Invariant.check(index >= 0 && index < sorts.length,
                () -> "no bound variable " + index + " in quantifier with " + sorts.length + " variables");
        return sorts[index];
    }

    @Override
    public void getEquivalenceClass(Expr a, List<Expr> eqc) {
        Objects.requireNonNull(a, "a");
        EqualityEngine ee = getEngine();
        if (ee.hasTerm(a)) {
            Expr rep = ee.getRepresentative(a);
            Iterator<Expr> it = ee.getEqClass(rep);
            while (it.hasNext()) {
                eqc.add(it.next());
            }
        } else {
            eqc.add(a);
        }
        Invariant.check(eqc.contains(a), () -> a + " is missing from its own equivalence class");
    }

    @Override
    public Expr getCongruentTerm(FuncDecl f, List<Expr> args) {
        return state.getTermDatabase().getCongruentTerm(f, args);
    }

    /**
     * First member of eqc reached by a depth-first, left-to-right search of n's subterms,
     * or n itself if it is a member and none of its subterms is. Null if neither holds.
     */
    private Expr getInstance(Expr n, Set<Expr> eqc) {
        Map<Expr, Optional<Expr>> cache = new HashMap<>();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(n));
        while (!stack.isEmpty()) {
            Frame f = stack.peek();
            if (cache.containsKey(f.node)) {
                stack.pop();
                continue;
            }
            if (f.next < f.children.length) {
                Expr child = f.children[f.next];
                Optional<Expr> found = cache.get(child);
                if (found == null) {
                    stack.push(new Frame(child));
                } else if (found.isPresent()) {
                    // first hit wins, no need to look at the remaining children
                    cache.put(f.node, found);
                    stack.pop();
                } else {
                    f.next++;
                }
                continue;
            }
            cache.put(f.node, eqc.contains(f.node) ? Optional.of(f.node) : Optional.empty());
            stack.pop();
        }
        return cache.get(n).orElse(null);
    }

    private static final class Frame {
        final Expr node;
        final Expr[] children;
        int next = 0;

        Frame(Expr node) {
            this.node = node;
            this.children = TermUtil.children(node);
        }
    }

    /**
     * -2 : invalid, -1 : undesired, otherwise : the smaller the score, the better.
     */
    int getRepScore(Expr n, Quantifier q, int index, Sort vTn) {
        TermAttributes attrs = state.getAttributes();
        if (options.isCegqiActive() && TermUtil.hasInstConstAttr(attrs, n)) {
            return -2;
        }
        if (!TypeUtils.isSubtypeOf(n, vTn)) {
            return -2;
        }
        TermDatabase tdb = state.getTermDatabase();
        if (options.isRestrictToInstantiationClosure() && (!tdb.isInstClosure(n) || !tdb.hasTermCurrent(n))) {
            return -1;
        }
        if (options.getMaxInstantiationLevel().isPresent()) {
            // prefer the lowest instantiation level
            Integer level = attrs.getInstLevel(n);
            if (level != null) {
                return level;
            }
            return options.isLevelInputOnly() ? -1 : 0;
        }
        if (options.getRepresentativeMode() == QuantRepMode.FIRST) {
            // prefer the term used as a representative earliest
            Integer first = repScore.getFirstChosen(n);
            return first == null ? -1 : first;
        }
        Invariant.check(options.getRepresentativeMode() == QuantRepMode.DEPTH,
                () -> "no score for representative mode " + options.getRepresentativeMode());
        return TermUtil.getTermDepth(attrs, n);
    }

    public int getResetCount() {
        return resetCount;
    }

    public RepScoreLedger getRepScoreLedger() {
        return repScore;
    }

    public RepresentativeCache getRepresentativeCache() {
        return intRep;
    }
}
