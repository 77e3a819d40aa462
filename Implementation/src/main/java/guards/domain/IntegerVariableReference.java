package guards.domain;

import java.util.Objects;

public class IntegerVariableReference implements ArithmeticExpression {
    public final Variable variable;

    public IntegerVariableReference(final Variable variable) {
        if (variable.type != VariableType.INTEGER) {
            throw new IllegalArgumentException("Variable '" + variable.name + "' is not of type " + VariableType.INTEGER + ".");
        }
        this.variable = variable;
    }

    @Override
    public void accept(ModelVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return this.variable.name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IntegerVariableReference that = (IntegerVariableReference) o;
        return Objects.equals(variable, that.variable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable);
    }
}
