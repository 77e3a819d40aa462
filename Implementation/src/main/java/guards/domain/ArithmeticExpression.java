package guards.domain;

/**
 * An expression that evaluates to an integer. Only arithmetic expressions
 * may appear as the operands of a {@link Comparison}.
 */
public interface ArithmeticExpression extends Expression {
}
