package guards.explanation;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

import java.io.IOException;
import java.io.StringWriter;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Asks a local Ollama server for an explanation through its
 * {@code /api/generate} endpoint, without streaming.
 */
public class OllamaExpressionExplainer implements ExpressionExplainer {
    public static final String DEFAULT_ENDPOINT = "http://localhost:11434/api/generate";
    public static final String DEFAULT_MODEL = "mistral:instruct";

    private final URI endpoint;
    private final String model;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final Configuration freeMarkerConfiguration;

    public OllamaExpressionExplainer() {
        this(URI.create(DEFAULT_ENDPOINT), DEFAULT_MODEL, Duration.ofSeconds(120));
    }

    public OllamaExpressionExplainer(URI endpoint, String model, Duration timeout) {
        this.endpoint = endpoint;
        this.model = model;
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .build();

        this.freeMarkerConfiguration = new Configuration(Configuration.VERSION_2_3_32);
        this.freeMarkerConfiguration.setClassForTemplateLoading(OllamaExpressionExplainer.class, "/templates");
        this.freeMarkerConfiguration.setDefaultEncoding("UTF-8");
        this.freeMarkerConfiguration.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        this.freeMarkerConfiguration.setLogTemplateExceptions(false);
        this.freeMarkerConfiguration.setWrapUncheckedExceptions(true);
        this.freeMarkerConfiguration.setFallbackOnNullLoopVariable(false);
    }

    @Override
    public String explain(String expression) throws IOException, InterruptedException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", this.model);
        payload.put("prompt", this.createPrompt(expression));
        payload.put("stream", false);

        HttpRequest request = HttpRequest.newBuilder()
            .uri(this.endpoint)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(new Gson().toJson(payload)))
            .timeout(this.timeout)
            .build();

        HttpResponse<String> response = this.httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        if (response.statusCode() != 200) {
            throw new IOException(
                "Explanation request failed with status: " + response.statusCode() + ", body: " + response.body());
        }

        try {
            JsonObject body = JsonParser.parseString(response.body()).getAsJsonObject();
            JsonElement text = body.get("response");
            if (text == null || text.isJsonNull()) {
                throw new IOException("Explanation response has no 'response' field: " + response.body());
            }
            return text.getAsString().trim();
        } catch (JsonParseException | IllegalStateException e) {
            throw new IOException("Explanation response is not a JSON object: " + response.body(), e);
        }
    }

    String createPrompt(String expression) throws IOException {
        Map<String, Object> root = new HashMap<>();
        root.put("statement", expression);

        try {
            Template template = this.freeMarkerConfiguration.getTemplate("ExplanationPrompt.ftl");
            StringWriter writer = new StringWriter();
            template.process(root, writer);
            return writer.toString();
        } catch (TemplateException e) {
            throw new IOException("Could not render the explanation prompt.", e);
        }
    }
}
