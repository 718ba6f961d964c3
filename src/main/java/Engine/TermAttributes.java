package Engine;

import com.microsoft.z3.Expr;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Side table of per-term annotations. Z3 terms carry no user data, so everything the
 * quantifier layer records about a term lives here, keyed by the (hash-consed) term.
 */
public class TermAttributes {

    private final Map<Expr, Integer> instLevels = new HashMap<>();
    private final Set<Expr> uninterpretedConstants = new HashSet<>();
    private final Set<Expr> instConstants = new HashSet<>();

    // memoized derived attributes
    private final Map<Expr, Integer> termDepth = new HashMap<>();
    private final Map<Expr, Boolean> hasInstConst = new HashMap<>();

    public void setInstLevel(Expr n, int level) {
        if (level < 0) {
            throw new IllegalArgumentException("Instantiation level must be non-negative: " + level);
        }
        instLevels.put(n, level);
    }

    /**
     * @return the recorded instantiation level, or null if the term has none
     */
    public Integer getInstLevel(Expr n) {
        return instLevels.get(n);
    }

    public void addUninterpretedConstant(Expr n) {
        uninterpretedConstants.add(n);
    }

    public boolean isUninterpretedConstant(Expr n) {
        return uninterpretedConstants.contains(n);
    }

    public void addInstConstant(Expr n) {
        if (instConstants.add(n)) {
            // a cached "false" could now be stale
            hasInstConst.clear();
        }
    }

    public boolean isInstConstant(Expr n) {
        return instConstants.contains(n);
    }

    Map<Expr, Integer> getTermDepthCache() {
        return termDepth;
    }

    Map<Expr, Boolean> getHasInstConstCache() {
        return hasInstConst;
    }
}
