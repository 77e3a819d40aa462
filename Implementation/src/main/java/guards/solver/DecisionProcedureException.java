package guards.solver;

import guards.VerificationException;

public class DecisionProcedureException extends VerificationException {
    public DecisionProcedureException(String message) {
        super(message);
    }

    public DecisionProcedureException(String message, Throwable cause) {
        super(message, cause);
    }
}
