package guards.repositories;

import guards.models.ExpressionPair;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads and appends expression pairs in a CSV file with the header columns
 * {@code original} and {@code simplified}. Other columns are ignored.
 */
public class ExpressionPairRepository {
    public static final String ORIGINAL = "original";
    public static final String SIMPLIFIED = "simplified";

    private static final CSVFormat READ_FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setIgnoreEmptyLines(true)
        .build();

    public static List<ExpressionPair> load(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = READ_FORMAT.parse(reader)) {
            Map<String, Integer> header = parser.getHeaderMap();
            for (String column : new String[]{ORIGINAL, SIMPLIFIED}) {
                if (header == null || !header.containsKey(column)) {
                    throw new IOException("'" + file + "' has no '" + column + "' column.");
                }
            }

            List<ExpressionPair> pairs = new ArrayList<>();
            for (CSVRecord record : parser) {
                // Short rows become pairs with a missing expression, which
                // the verifier reports as an error for that pair only.
                pairs.add(new ExpressionPair(
                    pairs.size() + 1,
                    record.isSet(ORIGINAL) ? record.get(ORIGINAL) : null,
                    record.isSet(SIMPLIFIED) ? record.get(SIMPLIFIED) : null
                ));
            }
            return pairs;
        }
    }

    public static void append(Path file, Iterable<ExpressionPair> pairs) throws IOException {
        boolean hasHeader = Files.exists(file) && Files.size(file) > 0;
        CSVFormat format = hasHeader
            ? CSVFormat.DEFAULT
            : CSVFormat.DEFAULT.builder().setHeader(ORIGINAL, SIMPLIFIED).build();

        try (Writer writer = Files.newBufferedWriter(
                file, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (ExpressionPair pair : pairs) {
                printer.printRecord(pair.original, pair.simplified);
            }
        }
    }
}
