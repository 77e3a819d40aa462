package guards.parsing;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

public enum TokenType {
    LPAREN("("),
    RPAREN(")"),

    AND("&&"),
    OR("||"),
    IMPLIES("->"),
    EQ("=="),
    NE("!="),
    GE(">="),
    LE("<="),

    GT(">"),
    LT("<"),
    NOT("!"),
    // Recognized so that they can be reported, but not part of the grammar.
    AMPERSAND("&"),
    PIPE("|"),
    ASSIGN("="),
    PLUS("+"),
    MINUS("-"),

    IDENTIFIER(null),
    INTEGER(null),
    BOOLEAN(null),
    ARITHMETIC(null);

    /** Operators and punctuation, longest symbols first. */
    static final List<TokenType> SYMBOLS = Arrays.stream(TokenType.values())
        .filter(type -> type.symbol != null)
        .sorted((a, b) -> b.symbol.length() - a.symbol.length())
        .collect(Collectors.toList());

    private final String symbol;

    TokenType(final String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return this.symbol;
    }

    public boolean isComparison() {
        return this == EQ || this == NE || this == GE || this == LE || this == GT || this == LT;
    }

    public boolean isOperand() {
        return this == IDENTIFIER || this == INTEGER || this == BOOLEAN || this == ARITHMETIC;
    }

    public boolean isUnsupported() {
        return this == AMPERSAND || this == PIPE || this == ASSIGN || this == PLUS || this == MINUS;
    }

    @Override
    public String toString() {
        return this.symbol == null ? this.name().toLowerCase() : this.symbol;
    }
}
