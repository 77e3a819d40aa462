package guards.parsing;

import guards.VerificationException;
import guards.domain.VariableType;

public class TypeConflictException extends VerificationException {
    public final String name;

    public TypeConflictException(String name, VariableType assigned, VariableType requested) {
        super("Identifier '" + name + "' is used as " + requested + " but was already assigned type " + assigned + ".");
        this.name = name;
    }
}
