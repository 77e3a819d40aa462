package guards.parsing;

import guards.VerificationException;

public class ParseException extends VerificationException {
    public final int tokenIndex;

    public ParseException(int tokenIndex, String expected, Token found) {
        super("Expected " + expected + " at token " + tokenIndex + " but found "
            + (found == null ? "end of expression" : "'" + found.text + "'") + ".");
        this.tokenIndex = tokenIndex;
    }
}
