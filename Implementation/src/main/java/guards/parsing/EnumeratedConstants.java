package guards.parsing;

import java.util.*;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The lexical class of identifiers that name fixed code values (state
 * machine modes, command codes) rather than variables: every identifier
 * starting with one of the reserved prefixes, plus a closed set of names.
 */
public class EnumeratedConstants {
    public static final List<String> DEFAULT_PREFIXES = Collections.singletonList("IN_");
    public static final List<String> DEFAULT_NAMES = Arrays.asList(
        "PLAY", "REW", "FF", "EMPTY", "DISCINSERT", "EJECT"
    );

    private final List<String> prefixes;
    private final Set<String> names;
    private final Pattern pattern;

    public EnumeratedConstants(Collection<String> prefixes, Collection<String> names) {
        this.prefixes = new ArrayList<>(prefixes);
        this.names = new TreeSet<>(names);
        this.pattern = Pattern.compile(this.createRegex());
    }

    public static EnumeratedConstants defaults() {
        return new EnumeratedConstants(DEFAULT_PREFIXES, DEFAULT_NAMES);
    }

    public boolean matches(String identifier) {
        if (this.names.contains(identifier)) {
            return true;
        }
        return this.prefixes.stream().anyMatch(identifier::startsWith);
    }

    /**
     * @return a regex matching a complete enumerated-constant token, for
     * embedding into larger usage patterns.
     */
    public String regex() {
        return this.pattern.pattern();
    }

    private String createRegex() {
        List<String> alternatives = new ArrayList<>();
        for (String prefix : this.prefixes) {
            alternatives.add(Pattern.quote(prefix) + "[A-Za-z0-9_.]*");
        }
        for (String name : this.names) {
            alternatives.add(Pattern.quote(name));
        }
        if (alternatives.isEmpty()) {
            // Matches nothing.
            return "(?!)";
        }
        return alternatives.stream()
            .collect(Collectors.joining("|", "(?<![A-Za-z0-9_.])(?:", ")(?![A-Za-z0-9_.])"));
    }
}
