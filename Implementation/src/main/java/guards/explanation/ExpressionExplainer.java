package guards.explanation;

import java.io.IOException;

/**
 * Translates a guard expression into prose.
 */
public interface ExpressionExplainer {
    String explain(String expression) throws IOException, InterruptedException;
}
