package guards;

import freemarker.template.TemplateException;
import guards.domain.Constant;
import guards.domain.Variable;
import guards.models.BatchReport;
import guards.models.ExpressionPair;
import guards.models.PairResult;
import guards.naming.NameMapping;
import guards.repositories.ExpressionPairRepository;
import guards.solver.Z3DecisionProcedureFactory;
import org.apache.commons.lang3.exception.ExceptionUtils;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

public class VerificationRunner {
    private final VerificationParameters parameters;
    private final PrintStream out;

    public static void main(String[] args) {
        // Arguments: <parameters.json> | <input.csv> <report.txt> [solver-timeout-ms]
        VerificationParameterFactory parameterFactory = new VerificationParameterFactory();

        try {
            VerificationParameters parameters;
            if (args.length == 1) {
                File parameterFile = new File(args[0]);
                if (!parameterFile.exists()) {
                    System.err.println("Error: '" + parameterFile + "' does not exist.");
                    System.exit(2);
                    return;
                }
                parameters = parameterFactory.load(parameterFile);
            } else {
                parameters = parameterFactory.create(args);
            }

            new VerificationRunner(parameters, System.out).run();
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(2);
        } catch (Exception e) {
            System.err.println(ExceptionUtils.getStackTrace(e));
            System.exit(1);
        }
    }

    public VerificationRunner(VerificationParameters parameters, PrintStream out) {
        this.parameters = parameters;
        this.out = out;
    }

    public BatchReport run() throws IOException, TemplateException {
        List<ExpressionPair> pairs = ExpressionPairRepository.load(Paths.get(this.parameters.getInputFile()));

        NameMapping names = NameMapping.empty();
        if (this.parameters.getNameMappingFile() != null) {
            names = NameMapping.load(Paths.get(this.parameters.getNameMappingFile()));
        }

        PairVerifier verifier = new PairVerifier(
            this.parameters.getEnumeratedConstants(),
            new EquivalenceChecker(
                new Z3DecisionProcedureFactory(this.parameters.getSolverTimeout()),
                this.parameters.areEnumeratedConstantsDistinct()
            )
        );
        BatchVerifier batchVerifier = new BatchVerifier(verifier, this.parameters.getWorkers());

        BatchReport batch = batchVerifier.run(pairs, this::printProgress);
        this.out.println();
        this.printSummary(batch);

        VerificationReportFactory reportFactory = new VerificationReportFactory();
        VerificationReport report = reportFactory.create(batch, names);

        Path reportFile = Paths.get(this.parameters.getReportFile());
        reportFactory.persistText(reportFile, report);
        this.out.println("Report written to " + reportFile);

        if (this.parameters.getJsonReportFile() != null) {
            Path jsonReportFile = Paths.get(this.parameters.getJsonReportFile());
            reportFactory.persistJson(jsonReportFile, report);
            this.out.println("JSON report written to " + jsonReportFile);
        }

        return batch;
    }

    private void printProgress(PairResult result, int completed, int total) {
        int percent = total == 0 ? 100 : (int) (100L * completed / total);
        this.out.print("\rVerifying pair " + completed + "/" + total + " (" + percent + "%)");

        if (result.isProblem()) {
            this.out.println();
            this.out.println("Pair " + result.pair.index + " " + result.verdict.result + ":");
            this.out.println("  Original: " + result.pair.original);
            this.out.println("  Simplified: " + result.pair.simplified);
            if (result.verdict.isError()) {
                this.out.println("  Error: " + result.verdict.error);
            } else {
                for (Map.Entry<Variable, Constant> entry : result.verdict.counterexample.entrySet()) {
                    this.out.println("  " + entry.getKey() + " = " + entry.getValue());
                }
            }
        }
        this.out.flush();
    }

    private void printSummary(BatchReport batch) {
        this.out.println("Total pairs processed: " + batch.getTotalCount());
        this.out.println("Equivalent pairs: " + batch.getEquivalentCount());
        this.out.println("Non-equivalent pairs: " + batch.getNotEquivalentCount());
        this.out.println("Errors: " + batch.getErrorCount());
    }
}
