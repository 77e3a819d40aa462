package guards.solver;

import guards.domain.BooleanExpression;
import guards.domain.Constant;
import guards.domain.Variable;

import java.util.Collection;
import java.util.Map;

/**
 * A single satisfiability session over boolean and linear integer
 * constraints. A session is used by one thread and closed after one query.
 */
public interface DecisionProcedure extends AutoCloseable {
    void assertConstraint(BooleanExpression constraint);

    SatisfiabilityStatus checkSatisfiable();

    /**
     * @return why the last check returned {@link SatisfiabilityStatus#UNKNOWN}.
     */
    String getReasonUnknown();

    /**
     * Reads the values of the given variables from the satisfying assignment
     * found by the last check. Only valid after a satisfiable result.
     */
    Map<Variable, Constant> getModel(Collection<Variable> variables);

    @Override
    void close();
}
