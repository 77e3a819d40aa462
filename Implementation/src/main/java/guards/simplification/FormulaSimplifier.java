package guards.simplification;

/**
 * Reduces a guard expression to an equivalent, usually shorter, one in the
 * same text syntax. Implementations live outside this project.
 */
public interface FormulaSimplifier {
    String simplify(String expression) throws SimplificationException;
}
