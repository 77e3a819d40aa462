package guards.parsing;

import guards.VerificationException;

public class TokenizeException extends VerificationException {
    public final int offset;

    public TokenizeException(String message, int offset) {
        super(message);
        this.offset = offset;
    }

    public static TokenizeException unrecognized(String text, int offset) {
        return new TokenizeException(
            "Unrecognized character '" + text.charAt(offset) + "' at offset " + offset + " in '" + text + "'.",
            offset
        );
    }
}
