package cache;

import com.microsoft.z3.Expr;
import com.microsoft.z3.Sort;
import utils.Log;

import java.util.HashMap;
import java.util.Map;

/**
 * Internal representatives chosen in the current round, keyed by the type context and the
 * equality engine's representative. Entries are only valid until the next {@link #clear()},
 * which the owner calls once per round; they are never invalidated one by one.
 */
public class RepresentativeCache {

    private final Map<Sort, Map<Expr, Expr>> intRep = new HashMap<>();

    // statistics, kept across rounds
    private long hitCount = 0;
    private long missCount = 0;
    private long clearCount = 0;

    /**
     * @return the cached choice, or null if (type, rep) was not chosen this round
     */
    public Expr get(Sort type, Expr rep) {
        Map<Expr, Expr> byRep = intRep.get(type);
        Expr chosen = byRep == null ? null : byRep.get(rep);
        if (chosen != null) {
            hitCount++;
        } else {
            missCount++;
        }
        return chosen;
    }

    public void put(Sort type, Expr rep, Expr chosen) {
        intRep.computeIfAbsent(type, t -> new HashMap<>()).put(rep, chosen);
    }

    public int size() {
        int size = 0;
        for (Map<Expr, Expr> byRep : intRep.values()) {
            size += byRep.size();
        }
        return size;
    }

    /**
     * Drops every entry; statistics are kept.
     */
    public void clear() {
        if (!intRep.isEmpty()) {
            Log.debug("Dropping " + size() + " cached representatives");
        }
        intRep.clear();
        clearCount++;
    }

    public long getHitCount() {
        return hitCount;
    }

    public long getMissCount() {
        return missCount;
    }

    public String getCacheStats() {
        long total = hitCount + missCount;
        double hitRate = total > 0 ? (double) hitCount / total * 100 : 0;

        return String.format("RepresentativeCache[size=%d, hits=%d, misses=%d, hitRate=%.2f%%, clears=%d]",
                           size(), hitCount, missCount, hitRate, clearCount);
    }
}
