package guards;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VerificationParameterFactoryTest {
    @TempDir
    Path tempDir;

    private final VerificationParameterFactory factory = new VerificationParameterFactory();

    @Test
    void testPersistAndLoad() throws IOException {
        VerificationParameters parameters = new VerificationParameters("pairs.csv", "report.txt", 500);
        parameters.setJsonReportFile("report.json");
        parameters.setWorkers(3);
        parameters.setEnumeratedConstants(List.of("MODE_"), List.of("OFF"));
        parameters.setEnumeratedConstantsDistinct(true);

        File file = tempDir.resolve("parameters.json").toFile();
        factory.persist(file, parameters);
        VerificationParameters loaded = factory.load(file);

        assertEquals("pairs.csv", loaded.getInputFile());
        assertEquals("report.txt", loaded.getReportFile());
        assertEquals("report.json", loaded.getJsonReportFile());
        assertNull(loaded.getNameMappingFile());
        assertEquals(500, loaded.getSolverTimeout());
        assertEquals(3, loaded.getWorkers());
        assertTrue(loaded.areEnumeratedConstantsDistinct());
        assertTrue(loaded.getEnumeratedConstants().matches("MODE_RUN"));
        assertFalse(loaded.getEnumeratedConstants().matches("PLAY"));
    }

    @Test
    void testMissingFieldsKeepDefaults() throws IOException {
        Path file = tempDir.resolve("parameters.json");
        Files.write(file, "{\"inputFile\": \"in.csv\", \"reportFile\": \"out.txt\"}".getBytes(StandardCharsets.UTF_8));

        VerificationParameters loaded = factory.load(file.toFile());

        assertEquals(VerificationParameters.DEFAULT_SOLVER_TIMEOUT, loaded.getSolverTimeout());
        assertEquals(1, loaded.getWorkers());
        assertFalse(loaded.areEnumeratedConstantsDistinct());
        assertTrue(loaded.getEnumeratedConstants().matches("EJECT"));
        assertTrue(loaded.getEnumeratedConstants().matches("IN_Idle"));
    }

    @Test
    void testMissingRequiredField() throws IOException {
        Path file = tempDir.resolve("parameters.json");
        Files.write(file, "{\"inputFile\": \"in.csv\"}".getBytes(StandardCharsets.UTF_8));

        assertThrows(IOException.class, () -> factory.load(file.toFile()));
    }

    @Test
    void testCreateFromArguments() {
        VerificationParameters parameters = factory.create(new String[]{"in.csv", "out.txt", "2500"});

        assertEquals("in.csv", parameters.getInputFile());
        assertEquals("out.txt", parameters.getReportFile());
        assertEquals(2500, parameters.getSolverTimeout());

        assertEquals(
            VerificationParameters.DEFAULT_SOLVER_TIMEOUT,
            factory.create(new String[]{"in.csv", "out.txt"}).getSolverTimeout()
        );
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> factory.create(new String[]{"in.csv"}));
        assertThrows(IllegalArgumentException.class, () -> factory.create(new String[]{"in.csv", "out.txt", "soon"}));
        assertThrows(IllegalArgumentException.class, () -> factory.create(new String[]{"in.csv", "out.txt", "-1"}));
    }
}
