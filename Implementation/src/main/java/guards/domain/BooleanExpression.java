package guards.domain;

/**
 * An expression that evaluates to a truth value: connectives, negations,
 * comparisons, boolean literals and references to boolean variables.
 */
public interface BooleanExpression extends Expression {
}
