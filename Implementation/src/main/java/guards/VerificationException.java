package guards;

/**
 * Base class of every failure that turns a single pair verification into
 * an error verdict.
 */
public class VerificationException extends RuntimeException {
    public VerificationException(String message) {
        super(message);
    }

    public VerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
