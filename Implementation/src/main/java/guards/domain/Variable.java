package guards.domain;

import java.util.Objects;

/**
 * A typed symbolic handle. Two handles with the same name denote the same
 * logical variable, so equality only looks at the name.
 */
public class Variable implements Model, Comparable<Variable> {
    public final String name;
    public final VariableType type;
    public final boolean isEnumeratedConstant;

    public Variable(String name, VariableType type) {
        this(name, type, false);
    }

    public Variable(String name, VariableType type, boolean isEnumeratedConstant) {
        this.name = Objects.requireNonNull(name);
        this.type = Objects.requireNonNull(type);
        this.isEnumeratedConstant = isEnumeratedConstant;
    }

    @Override
    public void accept(ModelVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public int compareTo(Variable other) {
        return this.name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return this.name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Variable variable = (Variable) o;
        return name.equals(variable.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }
}
