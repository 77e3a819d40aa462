package guards;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

public class VerificationParameterFactory {
    public void persist(File file, VerificationParameters parameters) throws IOException {
        GsonBuilder builder = new GsonBuilder();
        builder.serializeNulls();
        builder.setPrettyPrinting();
        Gson gson = builder.create();

        String json = gson.toJson(parameters);

        Files.write(file.toPath(), json.getBytes(StandardCharsets.UTF_8));
    }

    public VerificationParameters load(File file) throws IOException {
        GsonBuilder builder = new GsonBuilder();
        builder.serializeNulls();
        Gson gson = builder.create();

        String json = new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);

        VerificationParameters parameters = gson.fromJson(json, VerificationParameters.class);
        if (parameters == null || parameters.getInputFile() == null || parameters.getReportFile() == null) {
            throw new IOException("Parameter file '" + file + "' must name an inputFile and a reportFile.");
        }
        if (parameters.getWorkers() < 1 || parameters.getSolverTimeout() < 0) {
            throw new IOException("Parameter file '" + file + "' has an invalid worker count or solver timeout.");
        }
        return parameters;
    }

    /**
     * Builds parameters from positional command line arguments:
     * {@code <input.csv> <report.txt> [solver-timeout-ms]}.
     */
    public VerificationParameters create(String[] args) {
        if (args.length < 2 || args.length > 3) {
            throw new IllegalArgumentException("Usage: <input.csv> <report.txt> [solver-timeout-ms]");
        }

        int solverTimeout = VerificationParameters.DEFAULT_SOLVER_TIMEOUT;
        if (args.length == 3) {
            try {
                solverTimeout = Integer.parseInt(args[2]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid solver timeout '" + args[2] + "'.", e);
            }
            if (solverTimeout < 0) {
                throw new IllegalArgumentException("Invalid solver timeout '" + args[2] + "'.");
            }
        }

        return new VerificationParameters(args[0], args[1], solverTimeout);
    }
}
