package guards;

import guards.domain.ConstantBoolean;
import guards.domain.ConstantInteger;
import guards.domain.Variable;
import guards.domain.VariableType;
import guards.models.Classification;
import guards.models.ExpressionPair;
import guards.models.Verdict;
import guards.parsing.EnumeratedConstants;
import guards.solver.Z3DecisionProcedureFactory;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class PairVerifierTest {
    private final PairVerifier verifier = new PairVerifier(
        EnumeratedConstants.defaults(),
        new EquivalenceChecker(new Z3DecisionProcedureFactory(10000))
    );

    @Test
    void testReflexivity() {
        for (String expression : List.of("A", "A && (B || !C)", "x + 1 > y -> flag", "mode == PLAY || mode == REW")) {
            assertTrue(verifier.verify(expression, expression).isEquivalent(), expression);
        }
    }

    @Test
    void testDoubleNegation() {
        assertTrue(verifier.verify("A || B && x > 2", "!(!(A || B && x > 2))").isEquivalent());
    }

    @Test
    void testDeMorgan() {
        assertTrue(verifier.verify("!(A && B)", "(!A) || (!B)").isEquivalent());
    }

    @Test
    void testNegatedStrictInequality() {
        assertTrue(verifier.verify("!(X > Y)", "X <= Y").isEquivalent());
    }

    @Test
    void testKnownMismatch() {
        Verdict verdict = verifier.verify("(A && B)", "(A || B)");

        assertEquals(Classification.NEQ, verdict.result);
        boolean a = ((ConstantBoolean) verdict.counterexample.get(new Variable("A", VariableType.BOOLEAN))).value;
        boolean b = ((ConstantBoolean) verdict.counterexample.get(new Variable("B", VariableType.BOOLEAN))).value;
        assertNotEquals(a, b);
    }

    @Test
    void testImplicationRewrite() {
        assertTrue(verifier.verify("A -> B", "(!A) || B").isEquivalent());
    }

    @Test
    void testArithmeticShift() {
        assertTrue(verifier.verify("X + 2 == Y", "X == Y - 2").isEquivalent());
        assertTrue(verifier.verify("(X + 2) == Y", "Y - X == 2").isEquivalent());
    }

    @Test
    void testCounterexampleIsSortedByName() {
        Verdict verdict = verifier.verify("b && a && c", "b && a");

        assertTrue(verdict.isNotEquivalent());
        List<String> names = verdict.counterexample.keySet().stream().map(v -> v.name).collect(Collectors.toList());
        assertEquals(List.of("a", "b", "c"), names);
    }

    @Test
    void testIntegerCounterexample() {
        Verdict verdict = verifier.verify("count >= 10", "count > 10");

        assertTrue(verdict.isNotEquivalent());
        assertEquals(new ConstantInteger(10), verdict.counterexample.get(new Variable("count", VariableType.INTEGER)));
    }

    @Test
    void testEnumeratedConstantsAreUnconstrained() {
        Verdict verdict = verifier.verify("mode == PLAY", "mode == PLAY && mode != REW");

        assertTrue(verdict.isNotEquivalent());
        assertEquals(
            verdict.counterexample.get(new Variable("PLAY", VariableType.INTEGER)),
            verdict.counterexample.get(new Variable("REW", VariableType.INTEGER))
        );

        Verdict sameCode = verifier.verify("PLAY == REW", "false");
        assertTrue(sameCode.isNotEquivalent());
        assertEquals(
            sameCode.counterexample.get(new Variable("PLAY", VariableType.INTEGER)),
            sameCode.counterexample.get(new Variable("REW", VariableType.INTEGER))
        );
    }

    @Test
    void testDistinctEnumeratedConstantsOnRequest() {
        PairVerifier distinct = new PairVerifier(
            EnumeratedConstants.defaults(),
            new EquivalenceChecker(new Z3DecisionProcedureFactory(10000), true)
        );

        assertTrue(distinct.verify("mode == PLAY", "mode == PLAY && mode != REW").isEquivalent());
        assertTrue(distinct.verify("PLAY == REW", "false").isEquivalent());
    }

    @Test
    void testCounterexampleBeyondLongRange() {
        Verdict verdict = verifier.verify("x - 1 > 9223372036854775807", "false");

        assertEquals(Classification.NEQ, verdict.result);
        BigInteger x = ((ConstantInteger) verdict.counterexample.get(new Variable("x", VariableType.INTEGER))).value;
        assertTrue(x.compareTo(BigInteger.valueOf(Long.MAX_VALUE).add(BigInteger.ONE)) > 0);
    }

    @Test
    void testTypeConflictIsError() {
        Verdict verdict = verifier.verify("A && (A + 1 == B)", "A");

        assertTrue(verdict.isError());
        assertEquals("Identifier 'A' is used as Bool but was already assigned type Int.", verdict.error);
    }

    @Test
    void testErrorsAreReportedAsVerdicts() {
        assertTrue(verifier.verify("(A && B", "A").isError());
        assertTrue(verifier.verify("A # B", "A").isError());
        assertTrue(verifier.verify("A", "A &").isError());
        assertEquals(Verdict.error("Missing simplified expression."), verifier.verify(new ExpressionPair(1, "A", null)));
    }

    @Test
    void testVerificationIsIdempotent() {
        assertEquals(verifier.verify("x > 3 || A", "x >= 3"), verifier.verify("x > 3 || A", "x >= 3"));
    }

    @Test
    void testNoLeakageBetweenCalls() {
        assertTrue(verifier.verify("x > 1", "x >= 2").isEquivalent());
        // x is a boolean here although it was an integer in the previous call.
        assertTrue(verifier.verify("x && y", "y && x").isEquivalent());
    }
}
