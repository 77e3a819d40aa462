package guards.explanation;

import guards.models.ExpressionPair;
import guards.repositories.ExpressionPairRepository;
import org.apache.commons.lang3.exception.ExceptionUtils;

import java.net.URI;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

public class ExplanationRunner {
    public static void main(String[] args) {
        // Arguments: <input.csv> <output-dir> [model] [endpoint]
        if (args.length < 2) {
            System.err.println("Usage: <input.csv> <output-dir> [model] [endpoint]");
            System.exit(2);
            return;
        }

        String model = args.length > 2 ? args[2] : OllamaExpressionExplainer.DEFAULT_MODEL;
        String endpoint = args.length > 3 ? args[3] : OllamaExpressionExplainer.DEFAULT_ENDPOINT;

        try {
            List<ExpressionPair> pairs = ExpressionPairRepository.load(Paths.get(args[0]));
            ExplanationGenerator generator = new ExplanationGenerator(
                new OllamaExpressionExplainer(URI.create(endpoint), model, Duration.ofSeconds(120))
            );
            generator.generate(pairs, Paths.get(args[1]));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println(ExceptionUtils.getStackTrace(e));
            System.exit(1);
        } catch (Exception e) {
            System.err.println(ExceptionUtils.getStackTrace(e));
            System.exit(1);
        }
    }
}
