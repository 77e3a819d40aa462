package guards;

import guards.domain.*;
import guards.models.Verdict;
import guards.solver.DecisionProcedure;
import guards.solver.DecisionProcedureFactory;
import org.apache.commons.lang3.exception.ExceptionUtils;

import java.util.List;
import java.util.SortedSet;
import java.util.stream.Collectors;

/**
 * Decides whether two boolean expressions over a shared variable table
 * agree under every assignment. The expressions are equivalent exactly if
 * {@code original XOR simplified} is unsatisfiable; otherwise the
 * satisfying assignment is a counterexample.
 */
public class EquivalenceChecker {
    private final DecisionProcedureFactory procedures;
    private final boolean areConstantsDistinct;

    public EquivalenceChecker(DecisionProcedureFactory procedures) {
        this(procedures, false);
    }

    /**
     * @param areConstantsDistinct whether different enumerated constants
     *                             must denote different values.
     */
    public EquivalenceChecker(DecisionProcedureFactory procedures, boolean areConstantsDistinct) {
        this.procedures = procedures;
        this.areConstantsDistinct = areConstantsDistinct;
    }

    public Verdict check(BooleanExpression original, BooleanExpression simplified) {
        CollectVariablesVisitor collector = new CollectVariablesVisitor();
        original.accept(collector);
        simplified.accept(collector);
        SortedSet<Variable> variables = collector.getVariables();

        try (DecisionProcedure procedure = this.procedures.open()) {
            procedure.assertConstraint(new Connective(original, Operator.XOR, simplified));

            if (this.areConstantsDistinct) {
                this.assertDistinctConstants(procedure, variables);
            }

            switch (procedure.checkSatisfiable()) {
                case UNSATISFIABLE:
                    return Verdict.equivalent();
                case SATISFIABLE:
                    return Verdict.notEquivalent(procedure.getModel(variables));
                default:
                    return Verdict.error("Decision procedure returned unknown: " + procedure.getReasonUnknown());
            }
        } catch (VerificationException e) {
            return Verdict.error(e.getMessage());
        } catch (RuntimeException e) {
            return Verdict.error("Decision procedure failed: " + ExceptionUtils.getRootCauseMessage(e));
        }
    }

    private void assertDistinctConstants(DecisionProcedure procedure, SortedSet<Variable> variables) {
        List<Variable> constants = variables.stream()
            .filter(v -> v.isEnumeratedConstant && v.type == VariableType.INTEGER)
            .collect(Collectors.toList());

        for (int i = 0; i < constants.size(); i++) {
            for (int j = i + 1; j < constants.size(); j++) {
                procedure.assertConstraint(new Comparison(
                    new IntegerVariableReference(constants.get(i)),
                    Operator.NE,
                    new IntegerVariableReference(constants.get(j))
                ));
            }
        }
    }
}
