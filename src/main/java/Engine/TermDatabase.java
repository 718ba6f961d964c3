package Engine;

import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import utils.Log;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Registry of the ground terms quantifier instantiation may use.
 *
 * <p>The congruence index maps a function and the representatives of its arguments to the
 * first registered application with that signature. It is built against the active
 * equality engine and is rebuilt by {@link #reset()}, and on lookup whenever terms were
 * registered, classes merged or the active engine was swapped since the last build.
 */
public class TermDatabase {

    private final QuantifiersState state;

    private final Set<Expr> terms = new LinkedHashSet<>();
    private final Set<Expr> inactive = new HashSet<>();
    private final Set<Expr> instClosure = new HashSet<>();

    private final Map<FuncDecl, Map<List<Expr>, Expr>> congruenceIndex = new HashMap<>();
    private boolean indexStale = true;
    // engine and merge count the index was built against
    private EqualityEngine indexedEngine;
    private long indexedMergeCount = -1;

    public TermDatabase(QuantifiersState state) {
        this.state = Objects.requireNonNull(state, "state");
    }

    /**
     * Registers n and all of its subterms.
     */
    public void registerTerm(Expr n) {
        Deque<Expr> stack = new ArrayDeque<>();
        stack.push(n);
        while (!stack.isEmpty()) {
            Expr cur = stack.pop();
            if (terms.add(cur)) {
                indexStale = true;
                for (Expr k : TermUtil.children(cur)) {
                    stack.push(k);
                }
            }
        }
    }

    public boolean isRegistered(Expr n) {
        return terms.contains(n);
    }

    public Set<Expr> getTerms() {
        return Collections.unmodifiableSet(terms);
    }

    public void setInstClosure(Expr n, boolean member) {
        if (member) {
            instClosure.add(n);
        } else {
            instClosure.remove(n);
        }
    }

    public boolean isInstClosure(Expr n) {
        return instClosure.contains(n);
    }

    public void setTermActive(Expr n, boolean active) {
        if (active) {
            inactive.remove(n);
        } else {
            inactive.add(n);
        }
    }

    /**
     * A term is current when it is registered and has not been deactivated.
     */
    public boolean hasTermCurrent(Expr n) {
        return terms.contains(n) && !inactive.contains(n);
    }

    public boolean reset() {
        rebuildIndex();
        return true;
    }

    private void rebuildIndex() {
        congruenceIndex.clear();
        int indexed = 0;
        for (Expr t : terms) {
            Expr[] kids = TermUtil.children(t);
            if (kids.length == 0 || inactive.contains(t)) {
                continue;
            }
            List<Expr> key = new ArrayList<>(kids.length);
            for (Expr k : kids) {
                key.add(representativeOf(k));
            }
            Map<List<Expr>, Expr> byArgs = congruenceIndex.computeIfAbsent(t.getFuncDecl(), f -> new HashMap<>());
            if (byArgs.putIfAbsent(key, t) == null) {
                indexed++;
            }
        }
        EqualityEngine ee = state.getActiveEqualityEngine();
        indexedEngine = ee;
        indexedMergeCount = ee.getMergeCount();
        indexStale = false;
        Log.debug("Congruence index rebuilt: " + indexed + " entries over " + congruenceIndex.size() + " functions");
    }

    /**
     * Returns an existing term f(t1..tn) with each ti equal to args[i], or null if there is none.
     */
    public Expr getCongruentTerm(FuncDecl f, List<Expr> args) {
        if (isIndexStale()) {
            rebuildIndex();
        }
        if (f.getDomainSize() != args.size()) {
            return null;
        }
        Map<List<Expr>, Expr> byArgs = congruenceIndex.get(f);
        if (byArgs == null) {
            return null;
        }
        List<Expr> key = new ArrayList<>(args.size());
        for (Expr a : args) {
            key.add(representativeOf(a));
        }
        return byArgs.get(key);
    }

    private boolean isIndexStale() {
        EqualityEngine ee = state.getActiveEqualityEngine();
        return indexStale || ee != indexedEngine || ee.getMergeCount() != indexedMergeCount;
    }

    private Expr representativeOf(Expr n) {
        EqualityEngine ee = state.getActiveEqualityEngine();
        return ee.hasTerm(n) ? ee.getRepresentative(n) : n;
    }
}
