package guards.domain;

import java.util.Objects;

public class BooleanVariableReference implements BooleanExpression {
    public final Variable variable;

    public BooleanVariableReference(final Variable variable) {
        if (variable.type != VariableType.BOOLEAN) {
            throw new IllegalArgumentException("Variable '" + variable.name + "' is not of type " + VariableType.BOOLEAN + ".");
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
        BooleanVariableReference that = (BooleanVariableReference) o;
        return Objects.equals(variable, that.variable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable);
    }
}
