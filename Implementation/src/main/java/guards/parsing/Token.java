package guards.parsing;

import guards.domain.Operator;

import java.util.Objects;

/**
 * A classified fragment of an expression. Arithmetic tokens keep a whole
 * {@code identifier (+|-) identifier-or-literal} fragment together; their
 * right operand is either {@link #rightName} or {@link #value}.
 */
public class Token {
    public final TokenType type;
    public final String text;
    public final int index;
    public final int offset;

    // IDENTIFIER: the name, ARITHMETIC: the left operand.
    public final String name;
    // INTEGER: the literal, ARITHMETIC: the right operand if it is a literal.
    public final Long value;
    public final Operator operator;
    public final String rightName;

    private Token(TokenType type, String text, int index, int offset, String name, Long value, Operator operator, String rightName) {
        this.type = type;
        this.text = text;
        this.index = index;
        this.offset = offset;
        this.name = name;
        this.value = value;
        this.operator = operator;
        this.rightName = rightName;
    }

    public static Token symbol(TokenType type, int index, int offset) {
        return new Token(type, type.getSymbol(), index, offset, null, null, null, null);
    }

    public static Token identifier(String name, int index, int offset) {
        return new Token(TokenType.IDENTIFIER, name, index, offset, name, null, null, null);
    }

    public static Token integer(String text, long value, int index, int offset) {
        return new Token(TokenType.INTEGER, text, index, offset, null, value, null, null);
    }

    public static Token bool(String text, int index, int offset) {
        return new Token(TokenType.BOOLEAN, text, index, offset, null, null, null, null);
    }

    public static Token arithmetic(String text, String left, Operator operator, String rightName, Long rightValue, int index, int offset) {
        return new Token(TokenType.ARITHMETIC, text, index, offset, left, rightValue, operator, rightName);
    }

    public boolean getBooleanValue() {
        return Boolean.parseBoolean(this.text.toLowerCase());
    }

    @Override
    public String toString() {
        return this.type.name() + "(" + this.text + ")@" + this.index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Token token = (Token) o;
        return index == token.index
            && offset == token.offset
            && type == token.type
            && text.equals(token.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, index, offset);
    }
}
