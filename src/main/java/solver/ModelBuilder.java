package solver;

import Engine.FirstOrderModel;
import Engine.QuantifiersState;
import Engine.RepSet;
import Engine.TermManager;
import Engine.TypeUtils;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Model;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Sort;
import com.microsoft.z3.Status;
import utils.Log;

import java.util.List;
import java.util.Objects;

/**
 * Turns a Z3 model into the finite model representative selection consults: every universe
 * element of an uninterpreted sort becomes a domain value, and is mapped back to the first
 * registered term the model assigns it to.
 */
public class ModelBuilder {

    private final QuantifiersState state;

    public ModelBuilder(QuantifiersState state) {
        this.state = Objects.requireNonNull(state, "state");
    }

    /**
     * Checks the assertions and, if they are satisfiable, builds and installs the model.
     *
     * @return the model, or null if the assertions are unsatisfiable or Z3 gave up
     */
    public FirstOrderModel checkAndBuild(List<BoolExpr> assertions) {
        Solver solver = state.getTermManager().getContext().mkSolver();
        for (BoolExpr assertion : assertions) {
            solver.add(assertion);
        }
        Status status = solver.check();
        if (status != Status.SATISFIABLE) {
            Log.info("No model, solver returned " + status);
            return null;
        }
        return build(solver.getModel());
    }

    public FirstOrderModel build(Model z3Model) {
        TermManager tm = state.getTermManager();
        RepSet repSet = new RepSet();
        for (Sort sort : z3Model.getSorts()) {
            for (Expr value : z3Model.getSortUniverse(sort)) {
                tm.registerUninterpretedConstant(value);
                repSet.add(sort, value);
            }
        }

        int mapped = 0;
        for (Expr t : state.getTermDatabase().getTerms()) {
            Sort sort = t.getSort();
            if (!TypeUtils.isUserSort(sort) || !repSet.hasType(sort) || tm.getAttributes().isUninterpretedConstant(t)) {
                continue;
            }
            Expr value = z3Model.eval(t, true);
            if (repSet.hasRep(value) && repSet.getTermForRepresentative(value) == null) {
                repSet.setTermForRepresentative(value, t);
                mapped++;
            }
        }
        Log.info("Built finite model " + repSet + ", " + mapped + " values mapped to terms");

        FirstOrderModel model = new FirstOrderModel(repSet, z3Model);
        state.setModel(model);
        return model;
    }
}
