package guards.domain;

import java.util.Objects;

public class ConstantBoolean implements BooleanExpression, Constant {
    public final boolean value;

    public ConstantBoolean(boolean value) {
        this.value = value;
    }

    @Override
    public void accept(ModelVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return Boolean.toString(this.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConstantBoolean that = (ConstantBoolean) o;
        return value == that.value;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }
}
