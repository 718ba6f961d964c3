package Engine;

import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import utils.Invariant;
import utils.Log;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Union-find over Z3 terms with congruence closure.
 *
 * <p>When two classes merge, a syntactic constant stays representative, otherwise the
 * representative of the first argument survives. Iterating a class starts at its
 * representative and continues with members in the order they joined.
 */
public class EqualityEngine {

    private final String name;
    private final TermAttributes attributes;

    // union-find links, a representative maps to itself
    private final Map<Expr, Expr> parent = new HashMap<>();
    // representative -> members, representative first
    private final Map<Expr, List<Expr>> members = new HashMap<>();
    // representative -> applications with an argument in that class
    private final Map<Expr, List<Expr>> useList = new HashMap<>();
    // (function, argument representatives) -> application
    private final Map<Signature, Expr> lookup = new HashMap<>();
    private final List<Expr[]> disequalities = new ArrayList<>();
    private final Deque<Expr[]> pending = new ArrayDeque<>();

    private boolean consistent = true;
    private long mergeCount = 0;

    public EqualityEngine(String name, TermAttributes attributes) {
        this.name = name;
        this.attributes = Objects.requireNonNull(attributes, "attributes");
    }

    public boolean hasTerm(Expr t) {
        return parent.containsKey(t);
    }

    /**
     * Registers t and all of its subterms, then closes under congruence.
     */
    public void addTerm(Expr t) {
        if (hasTerm(t)) {
            return;
        }
        // post-order, children before parents
        Deque<Expr> stack = new ArrayDeque<>();
        stack.push(t);
        while (!stack.isEmpty()) {
            Expr cur = stack.peek();
            if (hasTerm(cur)) {
                stack.pop();
                continue;
            }
            boolean ready = true;
            for (Expr k : TermUtil.children(cur)) {
                if (!hasTerm(k)) {
                    stack.push(k);
                    ready = false;
                }
            }
            if (ready) {
                stack.pop();
                register(cur);
            }
        }
        propagate();
    }

    private void register(Expr t) {
        parent.put(t, t);
        List<Expr> cls = new ArrayList<>();
        cls.add(t);
        members.put(t, cls);
        Expr[] kids = TermUtil.children(t);
        if (kids.length == 0) {
            return;
        }
        for (Expr k : kids) {
            useList.computeIfAbsent(find(k), x -> new ArrayList<>()).add(t);
        }
        Signature sig = signature(t);
        Expr other = lookup.get(sig);
        if (other == null) {
            lookup.put(sig, t);
        } else {
            pending.add(new Expr[]{other, t});
        }
    }

    public void assertEquality(Expr a, Expr b) {
        addTerm(a);
        addTerm(b);
        pending.add(new Expr[]{a, b});
        propagate();
    }

    public void assertDisequality(Expr a, Expr b) {
        addTerm(a);
        addTerm(b);
        if (areEqual(a, b)) {
            markInconsistent("disequality between equal terms " + a + " and " + b);
        }
        disequalities.add(new Expr[]{a, b});
    }

    private void propagate() {
        while (!pending.isEmpty()) {
            Expr[] eq = pending.poll();
            Expr ra = find(eq[0]);
            Expr rb = find(eq[1]);
            if (ra.equals(rb)) {
                continue;
            }
            boolean constA = TermUtil.isConstValue(attributes, ra);
            boolean constB = TermUtil.isConstValue(attributes, rb);
            if (constA && constB) {
                markInconsistent("merging distinct values " + ra + " and " + rb);
            } else if (areDisequalReps(ra, rb)) {
                markInconsistent("merging disequal classes of " + ra + " and " + rb);
            }
            Expr keep = ra;
            Expr lose = rb;
            if (constB && !constA) {
                keep = rb;
                lose = ra;
            }
            merge(keep, lose);
        }
    }

    private void merge(Expr keep, Expr lose) {
        parent.put(lose, keep);
        mergeCount++;
        members.get(keep).addAll(members.remove(lose));

        List<Expr> uses = useList.remove(lose);
        if (uses == null) {
            return;
        }
        List<Expr> keepUses = useList.computeIfAbsent(keep, x -> new ArrayList<>());
        for (Expr app : uses) {
            Signature sig = signature(app);
            Expr other = lookup.get(sig);
            if (other == null) {
                lookup.put(sig, app);
            } else if (!find(other).equals(find(app))) {
                pending.add(new Expr[]{other, app});
            }
            keepUses.add(app);
        }
    }

    private void markInconsistent(String reason) {
        if (consistent) {
            Log.warn("Equality engine " + name + " became inconsistent: " + reason);
        }
        consistent = false;
    }

    /**
     * Number of class merges so far. Representatives can only have changed if it moved.
     */
    public long getMergeCount() {
        return mergeCount;
    }

    public boolean isConsistent() {
        return consistent;
    }

    private Expr find(Expr t) {
        Expr root = t;
        Expr next = parent.get(root);
        while (!next.equals(root)) {
            root = next;
            next = parent.get(root);
        }
        // path compression
        Expr cur = t;
        while (!cur.equals(root)) {
            Expr up = parent.get(cur);
            parent.put(cur, root);
            cur = up;
        }
        return root;
    }

    public Expr getRepresentative(Expr t) {
        Invariant.check(hasTerm(t), () -> "term not in equality engine " + name + ": " + t);
        return find(t);
    }

    public boolean areEqual(Expr a, Expr b) {
        return getRepresentative(a).equals(getRepresentative(b));
    }

    /**
     * Two terms are disequal when their classes hold distinct values or a disequality was
     * asserted between them. No explanation is produced, ensureProof is accepted for
     * callers that would otherwise request one.
     */
    public boolean areDisequal(Expr a, Expr b, boolean ensureProof) {
        return areDisequalReps(getRepresentative(a), getRepresentative(b));
    }

    private boolean areDisequalReps(Expr ra, Expr rb) {
        if (ra.equals(rb)) {
            return false;
        }
        if (TermUtil.isConstValue(attributes, ra) && TermUtil.isConstValue(attributes, rb)) {
            return true;
        }
        for (Expr[] d : disequalities) {
            Expr r0 = find(d[0]);
            Expr r1 = find(d[1]);
            if ((r0.equals(ra) && r1.equals(rb)) || (r0.equals(rb) && r1.equals(ra))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Iterates the class of a representative.
     */
    public Iterator<Expr> getEqClass(Expr rep) {
        List<Expr> cls = members.get(rep);
        Invariant.check(cls != null, () -> "not a representative in " + name + ": " + rep);
        return Collections.unmodifiableList(cls).iterator();
    }

    public int getNumClasses() {
        return members.size();
    }

    private Signature signature(Expr app) {
        Expr[] kids = TermUtil.children(app);
        Expr[] reps = new Expr[kids.length];
        for (int i = 0; i < kids.length; i++) {
            reps[i] = find(kids[i]);
        }
        return new Signature(app.getFuncDecl(), reps);
    }

    private static final class Signature {
        private final FuncDecl decl;
        private final Expr[] argReps;

        Signature(FuncDecl decl, Expr[] argReps) {
            this.decl = decl;
            this.argReps = argReps;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Signature)) return false;
            Signature other = (Signature) o;
            return decl.equals(other.decl) && Arrays.equals(argReps, other.argReps);
        }

        @Override
        public int hashCode() {
            return 31 * decl.hashCode() + Arrays.hashCode(argReps);
        }
    }
}
