package guards.parsing;

import guards.domain.VariableType;

import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies identifiers as boolean or integer from how they are used in
 * the text. Every identifier starts out as a boolean and is reclassified
 * as an integer if any of the following usages occurs anywhere in the text:
 * <ul>
 *     <li>an addition or subtraction with a literal or another identifier,</li>
 *     <li>a comparison against a numeric literal,</li>
 *     <li>an equality test against an enumerated constant.</li>
 * </ul>
 * Enumerated constants themselves are always integers. The rules are
 * evaluated against the whole text, so the result does not depend on the
 * order in which identifiers occur.
 */
public class TypeInferencer {
    private static final Pattern IDENTIFIER = Pattern.compile("(?<![A-Za-z0-9_.])[A-Za-z_][A-Za-z0-9_.]*");

    private static final String BEFORE = "(?<![A-Za-z0-9_.])";
    private static final String AFTER = "(?![A-Za-z0-9_.])";
    private static final String LITERAL = BEFORE + "\\d+";
    private static final String OPERAND = "(?:\\d|[A-Za-z_])";
    private static final String COMPARISON = "(?:==|!=|>=|<=|>|<)";
    private static final String EQUALITY = "(?:==|!=)";

    private final EnumeratedConstants constants;

    public TypeInferencer(EnumeratedConstants constants) {
        this.constants = constants;
    }

    public Map<String, VariableType> infer(String original, String simplified) {
        return this.infer(original + " " + simplified);
    }

    public Map<String, VariableType> infer(String text) {
        Map<String, VariableType> types = new TreeMap<>();

        Matcher matcher = IDENTIFIER.matcher(text);
        while (matcher.find()) {
            String identifier = matcher.group();
            if (isBooleanLiteral(identifier) || types.containsKey(identifier)) {
                continue;
            }
            types.put(identifier, this.classify(identifier, text));
        }

        return types;
    }

    private VariableType classify(String identifier, String text) {
        if (this.constants.matches(identifier)) {
            return VariableType.INTEGER;
        }

        String name = BEFORE + Pattern.quote(identifier) + AFTER;
        String constant = "(?:" + this.constants.regex() + ")";

        boolean isArithmeticOperand =
            find(name + "\\s*[+-]\\s*" + OPERAND, text)
                || find(LITERAL + "\\s*[+-]\\s*" + name, text)
                || find(BEFORE + "[A-Za-z_][A-Za-z0-9_.]*\\s*[+-]\\s*" + name, text);

        boolean isComparedToLiteral =
            find(name + "\\s*" + COMPARISON + "\\s*-?\\s*\\d", text)
                || find(LITERAL + "\\s*" + COMPARISON + "\\s*" + name, text);

        boolean isComparedToConstant =
            find(name + "\\s*" + EQUALITY + "\\s*" + constant, text)
                || find(constant + "\\s*" + EQUALITY + "\\s*" + name, text);

        if (isArithmeticOperand || isComparedToLiteral || isComparedToConstant) {
            return VariableType.INTEGER;
        }
        return VariableType.BOOLEAN;
    }

    static boolean isBooleanLiteral(String identifier) {
        return identifier.equalsIgnoreCase("true") || identifier.equalsIgnoreCase("false");
    }

    private static boolean find(String regex, String text) {
        return Pattern.compile(regex).matcher(text).find();
    }
}
