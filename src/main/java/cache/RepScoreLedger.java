package cache;

import com.microsoft.z3.Expr;

import java.util.HashMap;
import java.util.Map;

/**
 * Round in which each term was first chosen as an internal representative.
 * Lives as long as the session: entries are added, never removed, so "first chosen"
 * stays stable across rounds.
 */
public class RepScoreLedger {

    private final Map<Expr, Integer> firstChosen = new HashMap<>();

    /**
     * Records term at generation unless it was recorded before.
     *
     * @return true if this is the first time term was chosen
     */
    public boolean recordIfAbsent(Expr term, int generation) {
        return firstChosen.putIfAbsent(term, generation) == null;
    }

    /**
     * @return the generation term was first chosen in, or null if it never was
     */
    public Integer getFirstChosen(Expr term) {
        return firstChosen.get(term);
    }

    public int size() {
        return firstChosen.size();
    }
}
