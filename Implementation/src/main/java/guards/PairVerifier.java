package guards;

import guards.domain.BooleanExpression;
import guards.models.ExpressionPair;
import guards.models.Verdict;
import guards.parsing.EnumeratedConstants;
import guards.parsing.Parser;
import guards.parsing.TypeInferencer;
import guards.parsing.VariableFactory;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Runs type inference, parsing and the equivalence check for one pair.
 * Every call gets its own variable table, so one instance can be shared
 * between threads.
 */
public class PairVerifier {
    private final EnumeratedConstants constants;
    private final EquivalenceChecker checker;

    public PairVerifier(EnumeratedConstants constants, EquivalenceChecker checker) {
        this.constants = constants;
        this.checker = checker;
    }

    public Verdict verify(ExpressionPair pair) {
        return this.verify(pair.original, pair.simplified);
    }

    public Verdict verify(String original, String simplified) {
        if (original == null || simplified == null) {
            return Verdict.error("Missing " + (original == null ? "original" : "simplified") + " expression.");
        }

        try {
            TypeInferencer inferencer = new TypeInferencer(this.constants);
            VariableFactory variables = new VariableFactory(inferencer.infer(original, simplified), this.constants);

            BooleanExpression originalExpression = Parser.parse(original, variables);
            BooleanExpression simplifiedExpression = Parser.parse(simplified, variables);

            return this.checker.check(originalExpression, simplifiedExpression);
        } catch (VerificationException e) {
            return Verdict.error(e.getMessage());
        } catch (RuntimeException e) {
            return Verdict.error(ExceptionUtils.getRootCauseMessage(e));
        }
    }
}
