package guards.domain;

/**
 * A literal value, either written in an expression or assigned to a
 * variable by a counterexample.
 */
public interface Constant extends Expression {
}
