package guards.domain;

public interface ModelVisitor {
    void visit(Variable variable);
    void visit(Operator operator);
    void visit(ConstantBoolean constant);
    void visit(ConstantInteger constant);
    void visit(BooleanVariableReference reference);
    void visit(IntegerVariableReference reference);
    void visit(Negation negation);
    void visit(Connective connective);
    void visit(Comparison comparison);
    void visit(ArithmeticOperation operation);
}
