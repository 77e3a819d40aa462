package guards.simplification;

public class SimplificationException extends Exception {
    public SimplificationException(String message) {
        super(message);
    }

    public SimplificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
