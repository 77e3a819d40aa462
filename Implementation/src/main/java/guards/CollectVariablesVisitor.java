package guards;

import guards.domain.*;

import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.SortedSet;

public class CollectVariablesVisitor implements ModelVisitor {
    private final Map<String, Variable> variables = new TreeMap<>();

    public SortedSet<Variable> getVariables() {
        return new TreeSet<>(this.variables.values());
    }

    @Override
    public void visit(Variable variable) {
        this.variables.putIfAbsent(variable.name, variable);
    }

    @Override
    public void visit(Operator operator) {
    }

    @Override
    public void visit(ConstantBoolean constant) {
    }

    @Override
    public void visit(ConstantInteger constant) {
    }

    @Override
    public void visit(BooleanVariableReference reference) {
        reference.variable.accept(this);
    }

    @Override
    public void visit(IntegerVariableReference reference) {
        reference.variable.accept(this);
    }

    @Override
    public void visit(Negation negation) {
        negation.operand.accept(this);
    }

    @Override
    public void visit(Connective connective) {
        connective.left.accept(this);
        connective.right.accept(this);
    }

    @Override
    public void visit(Comparison comparison) {
        comparison.left.accept(this);
        comparison.right.accept(this);
    }

    @Override
    public void visit(ArithmeticOperation operation) {
        operation.left.accept(this);
        operation.right.accept(this);
    }
}
