package guards.naming;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The reverse-mapping table written when long identifiers are renamed to
 * short canonical names, one {@code <short-name> -> "<original>"} line per
 * name. Original values may themselves mention other short names.
 */
public class NameMapping {
    public static final String HEADING = "Variable Mappings:";

    private static final String OPERATOR_CHARACTERS = "&|=!<>+-*/ ";

    private final Map<String, String> mappings;
    private final Pattern names;

    public NameMapping(Map<String, String> mappings) {
        this.mappings = new LinkedHashMap<>(mappings);
        this.names = createPattern(this.mappings.keySet());
    }

    public static NameMapping empty() {
        return new NameMapping(Collections.emptyMap());
    }

    public static NameMapping load(Path file) throws IOException {
        return parse(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
    }

    public static NameMapping parse(String text) {
        int heading = text.indexOf(HEADING);
        String section = heading == -1 ? text : text.substring(heading + HEADING.length());

        Map<String, String> mappings = new LinkedHashMap<>();
        for (String line : section.split("\\R")) {
            int arrow = line.indexOf("->");
            if (arrow == -1) {
                continue;
            }
            String name = line.substring(0, arrow).trim();
            String value = stripQuotes(line.substring(arrow + 2).trim());
            if (!name.isEmpty()) {
                mappings.put(name, value);
            }
        }
        return new NameMapping(mappings);
    }

    public boolean isEmpty() {
        return this.mappings.isEmpty();
    }

    public Map<String, String> getMappings() {
        return Collections.unmodifiableMap(this.mappings);
    }

    /**
     * @return the original text of a short name with every short name in it
     * expanded as well, or the name itself if it is not mapped.
     */
    public String resolve(String name) {
        return this.resolve(name, new HashSet<>());
    }

    /**
     * Replaces every mapped name in an expression by its original text.
     * Originals that contain operators or spaces are parenthesized.
     */
    public String expand(String expression) {
        return this.replace(expression, new HashSet<>());
    }

    private String resolve(String name, Set<String> visited) {
        String value = this.mappings.get(name);
        if (value == null || !visited.add(name)) {
            return name;
        }
        return this.replace(value, visited);
    }

    private String replace(String text, Set<String> visited) {
        if (this.names == null) {
            return text;
        }

        Matcher matcher = this.names.matcher(text);
        StringBuffer result = new StringBuffer();
        while (matcher.find()) {
            String name = matcher.group();
            String resolved = this.resolve(name, new HashSet<>(visited));
            if (!resolved.equals(name) && containsOperator(resolved)) {
                resolved = "(" + resolved + ")";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(resolved));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static boolean containsOperator(String text) {
        return text.chars().anyMatch(c -> OPERATOR_CHARACTERS.indexOf(c) != -1);
    }

    private static String stripQuotes(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    // Longest names first so that "AB" is not matched as "A".
    private static Pattern createPattern(Collection<String> names) {
        if (names.isEmpty()) {
            return null;
        }
        return Pattern.compile(names.stream()
            .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
            .map(Pattern::quote)
            .collect(Collectors.joining("|", "(?<![A-Za-z0-9_.])(?:", ")(?![A-Za-z0-9_.])")));
    }
}
