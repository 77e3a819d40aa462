package guards.domain;

import java.math.BigInteger;
import java.util.Objects;

/**
 * An integer literal. Values are unbounded since satisfying assignments read
 * from the decision procedure may exceed the range of {@code long}.
 */
public class ConstantInteger implements ArithmeticExpression, Constant {
    public final BigInteger value;

    public ConstantInteger(long value) {
        this(BigInteger.valueOf(value));
    }

    public ConstantInteger(BigInteger value) {
        this.value = Objects.requireNonNull(value);
    }

    @Override
    public void accept(ModelVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return this.value.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConstantInteger that = (ConstantInteger) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
