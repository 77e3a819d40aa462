package guards.domain;

import java.util.Objects;

public class Negation implements BooleanExpression {
    public final BooleanExpression operand;

    public Negation(final BooleanExpression operand) {
        this.operand = Objects.requireNonNull(operand);
    }

    @Override
    public void accept(ModelVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return "!" + this.operand;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Negation negation = (Negation) o;
        return Objects.equals(operand, negation.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operand);
    }
}
