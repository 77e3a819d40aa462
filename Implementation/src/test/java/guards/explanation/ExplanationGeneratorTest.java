package guards.explanation;

import guards.models.ExpressionPair;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ExplanationGeneratorTest {
    @TempDir
    Path tempDir;

    @Test
    void testGenerate() throws Exception {
        ExpressionExplainer explainer = mock(ExpressionExplainer.class);
        when(explainer.explain("A")).thenReturn("A holds.");
        when(explainer.explain("x > 2")).thenReturn("x exceeds two.");

        Path output = tempDir.resolve("nl_outputs");
        List<Path> files = new ExplanationGenerator(explainer).generate(List.of(
            new ExpressionPair(1, "A || A", "A"),
            new ExpressionPair(2, "x > 1 && x > 2", null),
            new ExpressionPair(3, "x > 2 || x > 3", "x > 2")
        ), output);

        assertEquals(List.of(output.resolve("nl_1.txt"), output.resolve("nl_3.txt")), files);
        assertEquals(
            "Logical Statement:\nx > 2\n\nFinal Combined Translation:\nx exceeds two.\n",
            new String(Files.readAllBytes(output.resolve("nl_3.txt")), StandardCharsets.UTF_8)
        );
        verify(explainer, times(2)).explain(anyString());
    }
}
