package Engine;

import com.microsoft.z3.Expr;
import com.microsoft.z3.Sort;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Domain values of a finite model, per sort, and the term each value was built from.
 */
public class RepSet {

    private final Map<Sort, List<Expr>> typeReps = new LinkedHashMap<>();
    private final Map<Expr, Expr> valuesToTerms = new HashMap<>();

    public void add(Sort sort, Expr value) {
        List<Expr> reps = typeReps.computeIfAbsent(sort, s -> new ArrayList<>());
        if (!reps.contains(value)) {
            reps.add(value);
        }
    }

    public boolean hasType(Sort sort) {
        return typeReps.containsKey(sort);
    }

    public boolean hasRep(Expr value) {
        List<Expr> reps = typeReps.get(value.getSort());
        return reps != null && reps.contains(value);
    }

    public List<Expr> getTypeReps(Sort sort) {
        return Collections.unmodifiableList(typeReps.getOrDefault(sort, List.of()));
    }

    public void setTermForRepresentative(Expr value, Expr term) {
        valuesToTerms.put(value, term);
    }

    /**
     * @return the term the model value stands for, or null if none was recorded
     */
    public Expr getTermForRepresentative(Expr value) {
        return valuesToTerms.get(value);
    }

    public void clear() {
        typeReps.clear();
        valuesToTerms.clear();
    }

    @Override
    public String toString() {
        return "RepSet" + typeReps;
    }
}
