package guards;

import guards.domain.ConstantBoolean;
import guards.domain.ConstantInteger;
import guards.domain.Variable;
import guards.domain.VariableType;
import guards.models.BatchReport;
import guards.models.Classification;
import guards.models.ExpressionPair;
import guards.models.PairResult;
import guards.models.Verdict;
import guards.naming.NameMapping;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VerificationReportFactoryTest {
    @TempDir
    Path tempDir;

    private final VerificationReportFactory factory = new VerificationReportFactory();

    private static BatchReport batch() {
        Map<Variable, guards.domain.Constant> counterexample = new LinkedHashMap<>();
        counterexample.put(new Variable("A", VariableType.BOOLEAN), new ConstantBoolean(true));
        counterexample.put(new Variable("x", VariableType.INTEGER), new ConstantInteger(-4));

        return new BatchReport(List.of(
            new PairResult(new ExpressionPair(1, "A", "A"), Verdict.equivalent(), 0.1f),
            new PairResult(new ExpressionPair(2, "A || x > 0", "A && x > 0"), Verdict.notEquivalent(counterexample), 0.2f),
            new PairResult(new ExpressionPair(3, "(A", "A"), Verdict.error("Expected ')' at token 2 but found end of expression."), 0.0f)
        ));
    }

    @Test
    void testCreate() {
        VerificationReport report = factory.create(batch(), NameMapping.parse("x -> \"sensor.level\""));

        assertEquals(3, report.getTotal());
        assertEquals(1, report.getEquivalent());
        assertEquals(1, report.getNonEquivalent());
        assertEquals(1, report.getErrors());
        assertEquals(2, report.getProblems().size());

        VerificationReport.Problem mismatch = report.getProblems().get(0);
        assertEquals(2, mismatch.getIndex());
        assertEquals("NEQ", mismatch.getResult());
        assertNull(mismatch.getError());
        assertEquals("A", mismatch.getCounterexample().get(0).getVariable());
        assertEquals("true", mismatch.getCounterexample().get(0).getValue());
        assertNull(mismatch.getCounterexample().get(0).getOriginalName());
        assertEquals("-4", mismatch.getCounterexample().get(1).getValue());
        assertEquals("sensor.level", mismatch.getCounterexample().get(1).getOriginalName());

        VerificationReport.Problem error = report.getProblems().get(1);
        assertEquals("ERROR", error.getResult());
        assertTrue(error.getCounterexample().isEmpty());
    }

    @Test
    void testRender() throws Exception {
        String text = factory.render(factory.create(batch(), NameMapping.parse("x -> \"sensor.level\"")));

        assertTrue(text.startsWith("Verification Summary:"));
        assertTrue(text.contains("Total pairs processed: 3"));
        assertTrue(text.contains("Equivalent pairs: 1"));
        assertTrue(text.contains("Non-equivalent pairs: 1"));
        assertTrue(text.contains("Errors: 1"));
        assertTrue(text.contains("Pair 2:\nOriginal: A || x > 0\nSimplified: A && x > 0\nCounterexample:\n  A = true\n  x = -4  (sensor.level)\n"));
        assertTrue(text.contains("Pair 3:\nOriginal: (A\nSimplified: A\nError: Expected ')' at token 2 but found end of expression.\n"));
        assertFalse(text.contains("Pair 1:"));
    }

    @Test
    void testRenderWithoutProblems() throws Exception {
        BatchReport batch = new BatchReport(List.of(
            new PairResult(new ExpressionPair(1, "A", "A"), Verdict.equivalent(), 0.1f)
        ));

        String text = factory.render(factory.create(batch, NameMapping.empty()));

        assertTrue(text.contains("Total pairs processed: 1"));
        assertFalse(text.contains("Detailed Results:"));
    }

    @Test
    void testPersistTextAndJson() throws Exception {
        VerificationReport report = factory.create(batch(), NameMapping.empty());
        Path textFile = tempDir.resolve("out/verification_results.txt");
        Path jsonFile = tempDir.resolve("out/verification_results.json");

        factory.persistText(textFile, report);
        factory.persistJson(jsonFile, report);

        assertEquals(factory.render(report), new String(Files.readAllBytes(textFile), StandardCharsets.UTF_8));

        VerificationReport loaded = factory.loadJson(jsonFile);
        assertEquals(3, loaded.getTotal());
        assertEquals(2, loaded.getProblems().size());
        assertEquals(Classification.NEQ, Classification.get(loaded.getProblems().get(0).getResult()));
        assertEquals(Classification.ERROR, Classification.get(loaded.getProblems().get(1).getResult()));
        assertEquals("x", loaded.getProblems().get(0).getCounterexample().get(1).getVariable());
        assertNull(loaded.getProblems().get(0).getCounterexample().get(1).getOriginalName());
    }
}
