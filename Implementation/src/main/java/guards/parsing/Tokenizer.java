package guards.parsing;

import guards.domain.Operator;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an expression into tokens, trying two-character operators before
 * one-character operators.
 * <p>
 * An identifier followed by {@code +} or {@code -} and a literal or a second
 * identifier becomes a single arithmetic token, so {@code x-1} is one token
 * while {@code x < -1} is an identifier, an operator and a negative literal.
 */
public class Tokenizer {

    public static String normalize(String expression) {
        return StringUtils.normalizeSpace(expression);
    }

    public List<Token> tokenize(String expression) {
        String text = normalize(expression);
        List<Token> tokens = new ArrayList<>();

        int position = 0;
        while (position < text.length()) {
            char c = text.charAt(position);

            if (c == ' ') {
                position++;
            } else if (isIdentifierStart(c)) {
                position = this.readIdentifier(text, position, tokens);
            } else if (isAsciiDigit(c)) {
                position = this.readInteger(text, position, position, tokens);
            } else if (c == '-' && !endsWithOperand(tokens) && isDigitAt(text, skipSpaces(text, position + 1))) {
                position = this.readInteger(text, position, skipSpaces(text, position + 1), tokens);
            } else {
                TokenType type = matchSymbol(text, position);
                if (type == null) {
                    throw TokenizeException.unrecognized(text, position);
                }
                tokens.add(Token.symbol(type, tokens.size(), position));
                position += type.getSymbol().length();
            }
        }

        return tokens;
    }

    private int readIdentifier(String text, int start, List<Token> tokens) {
        int end = identifierEnd(text, start);
        String name = text.substring(start, end);

        if (TypeInferencer.isBooleanLiteral(name)) {
            tokens.add(Token.bool(name, tokens.size(), start));
            return end;
        }

        int signPosition = skipSpaces(text, end);
        if (signPosition < text.length() && isArithmeticSign(text, signPosition)) {
            Operator operator = text.charAt(signPosition) == '+' ? Operator.PLUS : Operator.MINUS;
            int operandStart = skipSpaces(text, signPosition + 1);

            if (isDigitAt(text, operandStart)) {
                int operandEnd = digitsEnd(text, operandStart);
                long value = parseLiteral(text.substring(operandStart, operandEnd), operandStart);
                tokens.add(Token.arithmetic(
                    text.substring(start, operandEnd), name, operator, null, value, tokens.size(), start
                ));
                return operandEnd;
            }

            if (operandStart < text.length() && isIdentifierStart(text.charAt(operandStart))) {
                int operandEnd = identifierEnd(text, operandStart);
                String rightName = text.substring(operandStart, operandEnd);
                if (!TypeInferencer.isBooleanLiteral(rightName)) {
                    tokens.add(Token.arithmetic(
                        text.substring(start, operandEnd), name, operator, rightName, null, tokens.size(), start
                    ));
                    return operandEnd;
                }
            }
        }

        tokens.add(Token.identifier(name, tokens.size(), start));
        return end;
    }

    private int readInteger(String text, int start, int digitsStart, List<Token> tokens) {
        int end = digitsEnd(text, digitsStart);
        String digits = text.substring(digitsStart, end);
        boolean isNegative = start != digitsStart;
        long value = parseLiteral(isNegative ? "-" + digits : digits, start);
        tokens.add(Token.integer(text.substring(start, end), value, tokens.size(), start));
        return end;
    }

    private static long parseLiteral(String literal, int offset) {
        try {
            return Long.parseLong(literal);
        } catch (NumberFormatException e) {
            throw new TokenizeException("Integer literal '" + literal + "' at offset " + offset + " is out of range.", offset);
        }
    }

    private static TokenType matchSymbol(String text, int position) {
        for (TokenType type : TokenType.SYMBOLS) {
            if (text.startsWith(type.getSymbol(), position)) {
                return type;
            }
        }
        return null;
    }

    private static boolean endsWithOperand(List<Token> tokens) {
        if (tokens.isEmpty()) {
            return false;
        }
        TokenType last = tokens.get(tokens.size() - 1).type;
        return last.isOperand() || last == TokenType.RPAREN;
    }

    // A '-' directly followed by '>' is an implication.
    private static boolean isArithmeticSign(String text, int position) {
        char c = text.charAt(position);
        if (c == '+') {
            return true;
        }
        return c == '-' && !(position + 1 < text.length() && text.charAt(position + 1) == '>');
    }

    private static boolean isIdentifierStart(char c) {
        return c >= 'a' && c <= 'z' || c >= 'A' && c <= 'Z' || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isAsciiDigit(c) || c == '.';
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isDigitAt(String text, int position) {
        return position < text.length() && isAsciiDigit(text.charAt(position));
    }

    private static int identifierEnd(String text, int position) {
        while (position < text.length() && isIdentifierPart(text.charAt(position))) {
            position++;
        }
        return position;
    }

    private static int digitsEnd(String text, int position) {
        while (isDigitAt(text, position)) {
            position++;
        }
        return position;
    }

    private static int skipSpaces(String text, int position) {
        while (position < text.length() && text.charAt(position) == ' ') {
            position++;
        }
        return position;
    }
}
