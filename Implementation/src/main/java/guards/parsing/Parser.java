package guards.parsing;

import guards.domain.*;

import java.util.List;

/**
 * Recursive descent parser for guard expressions.
 * <p>
 * Precedence from high to low: parenthesized group, negation, comparison,
 * {@code &&}, {@code ||}, {@code ->}. Conjunction and disjunction associate
 * to the left, implication to the right. A negation applies to the whole
 * term that follows it, comparison included.
 * <p>
 * Every method takes the index of the token to start at and returns the
 * parsed expression together with the index of the first unconsumed token,
 * so partial parses can be run from any position.
 */
public class Parser {
    private final List<Token> tokens;
    private final VariableFactory variables;

    public Parser(List<Token> tokens, VariableFactory variables) {
        this.tokens = tokens;
        this.variables = variables;
    }

    public static BooleanExpression parse(String expression, VariableFactory variables) {
        return new Parser(new Tokenizer().tokenize(expression), variables).parse();
    }

    public BooleanExpression parse() {
        Parsed<BooleanExpression> result = this.parseImplication(0);
        if (result.next < this.tokens.size()) {
            Token trailing = this.tokens.get(result.next);
            String expected = trailing.type.isUnsupported() ? "a supported operator" : "end of expression";
            throw new ParseException(result.next, expected, trailing);
        }
        return result.expression;
    }

    public Parsed<BooleanExpression> parseImplication(int index) {
        Parsed<BooleanExpression> left = this.parseDisjunction(index);

        if (this.isAt(left.next, TokenType.IMPLIES)) {
            Parsed<BooleanExpression> right = this.parseImplication(left.next + 1);
            return new Parsed<>(new Connective(left.expression, Operator.IMPLIES, right.expression), right.next);
        }

        return left;
    }

    public Parsed<BooleanExpression> parseDisjunction(int index) {
        Parsed<BooleanExpression> result = this.parseConjunction(index);

        while (this.isAt(result.next, TokenType.OR)) {
            Parsed<BooleanExpression> right = this.parseConjunction(result.next + 1);
            result = new Parsed<>(new Connective(result.expression, Operator.OR, right.expression), right.next);
        }

        return result;
    }

    public Parsed<BooleanExpression> parseConjunction(int index) {
        Parsed<BooleanExpression> result = this.parseTerm(index);

        while (this.isAt(result.next, TokenType.AND)) {
            Parsed<BooleanExpression> right = this.parseTerm(result.next + 1);
            result = new Parsed<>(new Connective(result.expression, Operator.AND, right.expression), right.next);
        }

        return result;
    }

    /**
     * Parses a negation, a parenthesized group, a comparison, or a bare
     * boolean literal or variable.
     */
    public Parsed<BooleanExpression> parseTerm(int index) {
        Token token = this.expect(index, "boolean term");

        switch (token.type) {
            case NOT:
                Parsed<BooleanExpression> operand = this.parseTerm(index + 1);
                return new Parsed<>(new Negation(operand.expression), operand.next);
            case LPAREN:
                return this.parseGroup(index);
            case IDENTIFIER:
            case INTEGER:
            case BOOLEAN:
            case ARITHMETIC:
                if (this.isComparisonAt(index + 1)) {
                    return this.parseComparison(this.parseArithmeticOperand(index));
                }
                return this.parseAtom(index);
            default:
                throw new ParseException(index, "boolean term", token);
        }
    }

    /**
     * Parses a parenthesized group starting at the opening parenthesis. A
     * group that only holds an arithmetic value and is followed by a
     * comparison operator becomes the left operand of that comparison.
     */
    public Parsed<BooleanExpression> parseGroup(int index) {
        this.expect(index, TokenType.LPAREN);

        int arithmeticGroupEnd = this.arithmeticGroupEnd(index);
        if (arithmeticGroupEnd != -1 && this.isComparisonAt(arithmeticGroupEnd)) {
            return this.parseComparison(this.parseArithmeticOperand(index));
        }

        Parsed<BooleanExpression> inner = this.parseImplication(index + 1);
        this.expect(inner.next, TokenType.RPAREN);

        if (this.isComparisonAt(inner.next + 1)) {
            throw new ParseException(inner.next + 1, "boolean connective or ')'", this.tokens.get(inner.next + 1));
        }

        return new Parsed<>(inner.expression, inner.next + 1);
    }

    public Parsed<ArithmeticExpression> parseArithmeticOperand(int index) {
        Token token = this.expect(index, "arithmetic operand");

        switch (token.type) {
            case INTEGER:
                return new Parsed<>(new ConstantInteger(token.value), index + 1);
            case IDENTIFIER:
                return new Parsed<>(this.integerReference(token.name), index + 1);
            case ARITHMETIC:
                ArithmeticExpression right = token.rightName == null
                    ? new ConstantInteger(token.value)
                    : this.integerReference(token.rightName);
                ArithmeticExpression operation = new ArithmeticOperation(
                    this.integerReference(token.name), token.operator, right
                );
                return new Parsed<>(operation, index + 1);
            case LPAREN:
                Parsed<ArithmeticExpression> inner = this.parseArithmeticOperand(index + 1);
                this.expect(inner.next, TokenType.RPAREN);
                return new Parsed<>(inner.expression, inner.next + 1);
            default:
                throw new ParseException(index, "arithmetic operand", token);
        }
    }

    private Parsed<BooleanExpression> parseComparison(Parsed<ArithmeticExpression> left) {
        Token token = this.tokens.get(left.next);
        Operator op = Operator.get(token.text);
        Parsed<ArithmeticExpression> right = this.parseArithmeticOperand(left.next + 1);
        return new Parsed<>(new Comparison(left.expression, op, right.expression), right.next);
    }

    private Parsed<BooleanExpression> parseAtom(int index) {
        Token token = this.tokens.get(index);

        if (token.type == TokenType.BOOLEAN) {
            return new Parsed<>(new ConstantBoolean(token.getBooleanValue()), index + 1);
        }
        if (token.type == TokenType.IDENTIFIER) {
            VariableType inferred = this.variables.getInferredType(token.name);
            if (inferred != VariableType.BOOLEAN) {
                throw new TypeConflictException(token.name, inferred, VariableType.BOOLEAN);
            }
            Variable variable = this.variables.getOrCreate(token.name, VariableType.BOOLEAN);
            return new Parsed<>(new BooleanVariableReference(variable), index + 1);
        }

        throw new ParseException(index + 1, "boolean term or comparison operator", this.next(index + 1));
    }

    private ArithmeticExpression integerReference(String name) {
        return new IntegerVariableReference(this.variables.getOrCreate(name, VariableType.INTEGER));
    }

    // Index after an arithmetic operand wrapped in one or more parentheses,
    // or -1 if the tokens at index do not form one.
    private int arithmeticGroupEnd(int index) {
        if (!this.isAt(index, TokenType.LPAREN)) {
            Token token = this.next(index);
            boolean isArithmetic = token != null && token.type.isOperand() && token.type != TokenType.BOOLEAN;
            return isArithmetic ? index + 1 : -1;
        }
        int innerEnd = this.arithmeticGroupEnd(index + 1);
        return innerEnd != -1 && this.isAt(innerEnd, TokenType.RPAREN) ? innerEnd + 1 : -1;
    }

    private boolean isAt(int index, TokenType type) {
        Token token = this.next(index);
        return token != null && token.type == type;
    }

    private boolean isComparisonAt(int index) {
        Token token = this.next(index);
        return token != null && token.type.isComparison();
    }

    private Token next(int index) {
        return index < this.tokens.size() ? this.tokens.get(index) : null;
    }

    private Token expect(int index, String expected) {
        Token token = this.next(index);
        if (token == null) {
            throw new ParseException(index, expected, null);
        }
        return token;
    }

    private void expect(int index, TokenType type) {
        Token token = this.next(index);
        if (token == null || token.type != type) {
            throw new ParseException(index, "'" + type + "'", token);
        }
    }

    public static class Parsed<T extends Expression> {
        public final T expression;
        public final int next;

        public Parsed(T expression, int next) {
            this.expression = expression;
            this.next = next;
        }
    }
}
