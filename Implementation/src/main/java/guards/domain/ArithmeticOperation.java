package guards.domain;

import java.util.Objects;

public class ArithmeticOperation implements ArithmeticExpression {
    public final ArithmeticExpression left;
    public final Operator op;
    public final ArithmeticExpression right;

    public ArithmeticOperation(
        final ArithmeticExpression left,
        final Operator op,
        final ArithmeticExpression right
    ) {
        if (!op.is(Operator.Category.ARITHMETIC)) {
            throw new IllegalArgumentException("'" + op + "' is not a " + Operator.Category.ARITHMETIC.name().toLowerCase() + " operator.");
        }
        this.left = Objects.requireNonNull(left);
        this.op = op;
        this.right = Objects.requireNonNull(right);
    }

    @Override
    public void accept(ModelVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return "(" + this.left + " " + this.op + " " + this.right + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ArithmeticOperation that = (ArithmeticOperation) o;
        return Objects.equals(left, that.left)
            && op == that.op
            && Objects.equals(right, that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, op, right);
    }
}
