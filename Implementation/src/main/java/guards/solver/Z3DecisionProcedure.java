package guards.solver;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.Model;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import guards.domain.BooleanExpression;
import guards.domain.Constant;
import guards.domain.ConstantBoolean;
import guards.domain.ConstantInteger;
import guards.domain.Variable;
import guards.domain.VariableType;
import guards.transformer.ModelToZ3Transformer;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

public class Z3DecisionProcedure implements DecisionProcedure {
    private final Context context;
    private final Solver solver;
    private final ModelToZ3Transformer modelToZ3;

    private Status status = null;

    public Z3DecisionProcedure(Map<String, String> settings) {
        this.context = new Context(settings);
        this.solver = this.context.mkSolver();
        this.modelToZ3 = new ModelToZ3Transformer(this.context);
    }

    @Override
    public void assertConstraint(BooleanExpression constraint) {
        try {
            this.solver.add(this.modelToZ3.transform(constraint));
        } catch (Z3Exception e) {
            throw new DecisionProcedureException("Unable to assert '" + constraint + "': " + e.getMessage(), e);
        }
    }

    @Override
    public SatisfiabilityStatus checkSatisfiable() {
        try {
            this.status = this.solver.check();
        } catch (Z3Exception e) {
            throw new DecisionProcedureException("Satisfiability check failed: " + e.getMessage(), e);
        }

        switch (this.status) {
            case SATISFIABLE:
                return SatisfiabilityStatus.SATISFIABLE;
            case UNSATISFIABLE:
                return SatisfiabilityStatus.UNSATISFIABLE;
            default:
                return SatisfiabilityStatus.UNKNOWN;
        }
    }

    @Override
    public String getReasonUnknown() {
        return this.status == Status.UNKNOWN ? this.solver.getReasonUnknown() : null;
    }

    @Override
    public Map<Variable, Constant> getModel(Collection<Variable> variables) {
        if (this.status != Status.SATISFIABLE) {
            throw new DecisionProcedureException("No model available, last check returned " + this.status + ".");
        }

        try {
            Model model = this.solver.getModel();
            Map<Variable, Constant> assignment = new LinkedHashMap<>();

            for (Variable variable : variables) {
                Expr<?> value = model.eval(this.modelToZ3.getConstant(variable), true);
                if (variable.type == VariableType.BOOLEAN) {
                    assignment.put(variable, new ConstantBoolean(value.isTrue()));
                } else {
                    assignment.put(variable, new ConstantInteger(((IntNum) value).getBigInteger()));
                }
            }

            return assignment;
        } catch (Z3Exception | ClassCastException e) {
            throw new DecisionProcedureException("Unable to read the model: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        this.context.close();
    }
}
