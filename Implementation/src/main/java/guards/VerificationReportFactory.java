package guards;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import guards.domain.Constant;
import guards.domain.Variable;
import guards.models.BatchReport;
import guards.models.PairResult;
import guards.naming.NameMapping;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

public class VerificationReportFactory {
    private final Configuration freeMarkerConfiguration;

    public VerificationReportFactory() {
        this.freeMarkerConfiguration = new Configuration(Configuration.VERSION_2_3_32);
        this.freeMarkerConfiguration.setClassForTemplateLoading(VerificationReportFactory.class, "/templates");
        this.freeMarkerConfiguration.setDefaultEncoding("UTF-8");
        this.freeMarkerConfiguration.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        this.freeMarkerConfiguration.setLogTemplateExceptions(false);
        this.freeMarkerConfiguration.setWrapUncheckedExceptions(true);
        this.freeMarkerConfiguration.setFallbackOnNullLoopVariable(false);
    }

    public VerificationReport create(BatchReport batch, NameMapping names) {
        List<VerificationReport.Problem> problems = new ArrayList<>();

        for (PairResult result : batch.getProblems()) {
            List<VerificationReport.Assignment> counterexample = new ArrayList<>();
            for (Map.Entry<Variable, Constant> entry : result.verdict.counterexample.entrySet()) {
                String name = entry.getKey().name;
                String originalName = names.resolve(name);
                counterexample.add(new VerificationReport.Assignment(
                    name,
                    entry.getValue().toString(),
                    originalName.equals(name) ? null : originalName
                ));
            }

            problems.add(new VerificationReport.Problem(
                result.pair.index,
                result.pair.original,
                result.pair.simplified,
                result.verdict.result.toString(),
                counterexample,
                result.verdict.error
            ));
        }

        return new VerificationReport(
            batch.getTotalCount(),
            batch.getEquivalentCount(),
            batch.getNotEquivalentCount(),
            batch.getErrorCount(),
            problems
        );
    }

    public String render(VerificationReport report) throws IOException, TemplateException {
        /* Create a data-model */
        Map<String, Object> root = new HashMap<>();
        root.put("report", report);

        /* Get the template (uses cache internally) */
        Template template = this.freeMarkerConfiguration.getTemplate("VerificationReport.ftl");

        /* Merge data-model with template */
        StringWriter writer = new StringWriter();
        template.process(root, writer);
        return writer.toString();
    }

    public void persistText(Path file, VerificationReport report) throws IOException, TemplateException {
        String text = this.render(report);
        createParentDirectories(file);
        Files.write(file, text.getBytes(StandardCharsets.UTF_8));
    }

    public void persistJson(Path file, VerificationReport report) throws IOException {
        GsonBuilder builder = new GsonBuilder();
        builder.serializeNulls();
        builder.setPrettyPrinting();
        Gson gson = builder.create();

        String json = gson.toJson(report);

        createParentDirectories(file);
        Files.write(file, json.getBytes(StandardCharsets.UTF_8));
    }

    public VerificationReport loadJson(Path file) throws IOException {
        Gson gson = new GsonBuilder().create();
        String json = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        return gson.fromJson(json, VerificationReport.class);
    }

    private static void createParentDirectories(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
