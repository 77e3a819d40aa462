package guards.parsing;

import guards.domain.Operator;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TokenizerTest {
    private final Tokenizer tokenizer = new Tokenizer();

    private List<TokenType> types(String expression) {
        return tokenizer.tokenize(expression).stream().map(token -> token.type).collect(Collectors.toList());
    }

    @Test
    void testConnectivesAndParentheses() {
        assertEquals(
            List.of(TokenType.LPAREN, TokenType.IDENTIFIER, TokenType.AND, TokenType.IDENTIFIER, TokenType.RPAREN,
                TokenType.OR, TokenType.NOT, TokenType.IDENTIFIER, TokenType.IMPLIES, TokenType.IDENTIFIER),
            types("(A&&B)||!C->D")
        );
    }

    @Test
    void testTwoCharacterOperatorsWin() {
        assertEquals(
            List.of(TokenType.IDENTIFIER, TokenType.GE, TokenType.IDENTIFIER, TokenType.AND,
                TokenType.IDENTIFIER, TokenType.NE, TokenType.INTEGER),
            types("a >= b && c != 0")
        );
    }

    @Test
    void testArithmeticFragmentIsOneToken() {
        List<Token> tokens = tokenizer.tokenize("x-1 < -2");

        assertEquals(3, tokens.size());

        Token arithmetic = tokens.get(0);
        assertEquals(TokenType.ARITHMETIC, arithmetic.type);
        assertEquals("x", arithmetic.name);
        assertEquals(Operator.MINUS, arithmetic.operator);
        assertEquals(1L, arithmetic.value);
        assertNull(arithmetic.rightName);

        assertEquals(TokenType.LT, tokens.get(1).type);

        Token literal = tokens.get(2);
        assertEquals(TokenType.INTEGER, literal.type);
        assertEquals(-2L, literal.value);
    }

    @Test
    void testArithmeticOnTwoIdentifiers() {
        Token token = tokenizer.tokenize("pos + offset == 3").get(0);

        assertEquals(TokenType.ARITHMETIC, token.type);
        assertEquals("pos + offset", token.text);
        assertEquals("pos", token.name);
        assertEquals(Operator.PLUS, token.operator);
        assertEquals("offset", token.rightName);
        assertNull(token.value);
    }

    @Test
    void testImplicationIsNotArithmetic() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.IMPLIES, TokenType.IDENTIFIER), types("A->B"));
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.IMPLIES, TokenType.IDENTIFIER), types("A -> B"));
    }

    @Test
    void testNegativeLiteralAfterOperator() {
        List<Token> tokens = tokenizer.tokenize("x > - 5");

        assertEquals(TokenType.INTEGER, tokens.get(2).type);
        assertEquals(-5L, tokens.get(2).value);
    }

    @Test
    void testBooleanLiterals() {
        List<Token> tokens = tokenizer.tokenize("TRUE || false");

        assertEquals(TokenType.BOOLEAN, tokens.get(0).type);
        assertTrue(tokens.get(0).getBooleanValue());
        assertEquals(TokenType.BOOLEAN, tokens.get(2).type);
        assertFalse(tokens.get(2).getBooleanValue());
    }

    @Test
    void testDottedIdentifier() {
        Token token = tokenizer.tokenize("door.is_open").get(0);

        assertEquals(TokenType.IDENTIFIER, token.type);
        assertEquals("door.is_open", token.name);
    }

    @Test
    void testWhitespaceIsNormalized() {
        List<Token> tokens = tokenizer.tokenize("  A \t&&\n   B ");

        assertEquals(3, tokens.size());
        assertEquals(2, tokens.get(1).offset);
        assertEquals(2, tokens.get(2).index);
    }

    @Test
    void testUnsupportedOperatorsAreTokens() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.AMPERSAND, TokenType.IDENTIFIER), types("A & B"));
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.INTEGER), types("A = 1"));
    }

    @Test
    void testUnrecognizedCharacter() {
        TokenizeException exception = assertThrows(TokenizeException.class, () -> tokenizer.tokenize("A # B"));

        assertEquals(2, exception.offset);
        assertTrue(exception.getMessage().contains("'#'"));
    }

    @Test
    void testNonAsciiDigitIsRejected() {
        assertThrows(TokenizeException.class, () -> tokenizer.tokenize("x > ５"));
    }

    @Test
    void testLiteralOutOfRange() {
        assertThrows(TokenizeException.class, () -> tokenizer.tokenize("x > 99999999999999999999"));
    }
}
