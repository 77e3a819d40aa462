package guards.explanation;

import guards.models.ExpressionPair;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes one {@code nl_<index>.txt} file per pair, holding the simplified
 * expression and its explanation.
 */
public class ExplanationGenerator {
    private final ExpressionExplainer explainer;

    public ExplanationGenerator(ExpressionExplainer explainer) {
        this.explainer = explainer;
    }

    public List<Path> generate(List<ExpressionPair> pairs, Path outputDirectory) throws IOException, InterruptedException {
        Files.createDirectories(outputDirectory);

        List<Path> written = new ArrayList<>();
        for (ExpressionPair pair : pairs) {
            if (pair.simplified == null) {
                System.err.println("Skipping pair " + pair.index + ": missing simplified expression.");
                continue;
            }

            String explanation = this.explainer.explain(pair.simplified);

            Path file = outputDirectory.resolve("nl_" + pair.index + ".txt");
            Files.write(file, format(pair.simplified, explanation).getBytes(StandardCharsets.UTF_8));
            System.out.println("Saved: " + file);
            written.add(file);
        }
        return written;
    }

    static String format(String statement, String explanation) {
        return "Logical Statement:\n" + statement + "\n\nFinal Combined Translation:\n" + explanation + "\n";
    }
}
