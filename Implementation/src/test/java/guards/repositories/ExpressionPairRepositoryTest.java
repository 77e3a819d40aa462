package guards.repositories;

import guards.models.ExpressionPair;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionPairRepositoryTest {
    @TempDir
    Path tempDir;

    private Path write(String content) throws IOException {
        Path file = tempDir.resolve("expressions.csv");
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    void testLoad() throws IOException {
        Path file = write("id,simplified,original\n7,A,A && A\n8,\"x, y\",\"B\"\n");

        List<ExpressionPair> pairs = ExpressionPairRepository.load(file);

        assertEquals(List.of(
            new ExpressionPair(1, "A && A", "A"),
            new ExpressionPair(2, "B", "x, y")
        ), pairs);
    }

    @Test
    void testShortRow() throws IOException {
        List<ExpressionPair> pairs = ExpressionPairRepository.load(write("original,simplified\nA\n"));

        assertEquals(1, pairs.size());
        assertEquals("A", pairs.get(0).original);
        assertNull(pairs.get(0).simplified);
    }

    @Test
    void testMissingColumn() throws IOException {
        Path file = write("original,result\nA,B\n");

        IOException exception = assertThrows(IOException.class, () -> ExpressionPairRepository.load(file));
        assertTrue(exception.getMessage().contains("'simplified'"));
    }

    @Test
    void testAppend() throws IOException {
        Path file = tempDir.resolve("collected.csv");

        ExpressionPairRepository.append(file, List.of(new ExpressionPair(1, "A || A", "A")));
        ExpressionPairRepository.append(file, List.of(new ExpressionPair(1, "x > 1 && x > 2", "x > 2")));

        List<ExpressionPair> pairs = ExpressionPairRepository.load(file);
        assertEquals(List.of(
            new ExpressionPair(1, "A || A", "A"),
            new ExpressionPair(2, "x > 1 && x > 2", "x > 2")
        ), pairs);

        String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        assertEquals(content.indexOf("original,simplified"), content.lastIndexOf("original,simplified"));
    }
}
