package guards.transformer;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.IntSort;
import guards.domain.*;

import java.util.HashMap;
import java.util.Map;
import java.util.Stack;

public class ModelToZ3Transformer {
    private final Context context;
    private final Map<Variable, BoolExpr> booleanConstants = new HashMap<>();
    private final Map<Variable, IntExpr> integerConstants = new HashMap<>();

    public ModelToZ3Transformer(Context context) {
        this.context = context;
    }

    public BoolExpr transform(BooleanExpression expression) {
        Z3ExpressionFactoryVisitor visitor = new Z3ExpressionFactoryVisitor();
        expression.accept(visitor);
        return visitor.getExpression();
    }

    public Expr<?> getConstant(Variable variable) {
        if (variable.type == VariableType.BOOLEAN) {
            return this.getBooleanConstant(variable);
        }
        return this.getIntegerConstant(variable);
    }

    private BoolExpr getBooleanConstant(Variable variable) {
        BoolExpr constant = this.booleanConstants.get(variable);
        if (constant == null) {
            constant = this.context.mkBoolConst(variable.name);
            this.booleanConstants.put(variable, constant);
        }
        return constant;
    }

    private IntExpr getIntegerConstant(Variable variable) {
        IntExpr constant = this.integerConstants.get(variable);
        if (constant == null) {
            constant = this.context.mkIntConst(variable.name);
            this.integerConstants.put(variable, constant);
        }
        return constant;
    }

    // Boolean and integer results are kept on separate stacks so that
    // every operand is popped with the sort its operator expects.
    private class Z3ExpressionFactoryVisitor implements ModelVisitor {
        private final Stack<BoolExpr> booleans = new Stack<>();
        private final Stack<ArithExpr<IntSort>> integers = new Stack<>();

        public BoolExpr getExpression() {
            assert this.booleans.size() == 1 && this.integers.isEmpty();
            return this.booleans.pop();
        }

        @Override
        public void visit(Variable variable) {
            if (variable.type == VariableType.BOOLEAN) {
                this.booleans.push(getBooleanConstant(variable));
            } else {
                this.integers.push(getIntegerConstant(variable));
            }
        }

        @Override
        public void visit(Operator operator) {
            throw new UnsupportedOperationException("Operators are transformed as part of their operation.");
        }

        @Override
        public void visit(ConstantBoolean constant) {
            this.booleans.push(context.mkBool(constant.value));
        }

        @Override
        public void visit(ConstantInteger constant) {
            this.integers.push(context.mkInt(constant.value.toString()));
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
            this.booleans.push(context.mkNot(this.booleans.pop()));
        }

        @Override
        public void visit(Connective connective) {
            connective.left.accept(this);
            connective.right.accept(this);
            BoolExpr right = this.booleans.pop();
            BoolExpr left = this.booleans.pop();

            switch (connective.op) {
                case AND:
                    this.booleans.push(context.mkAnd(left, right));
                    break;
                case OR:
                    this.booleans.push(context.mkOr(left, right));
                    break;
                case IMPLIES:
                    this.booleans.push(context.mkImplies(left, right));
                    break;
                case XOR:
                    this.booleans.push(context.mkXor(left, right));
                    break;
                default:
                    throw new UnsupportedOperationException("Unsupported connective '" + connective.op + "'.");
            }
        }

        @Override
        public void visit(Comparison comparison) {
            comparison.left.accept(this);
            comparison.right.accept(this);
            ArithExpr<IntSort> right = this.integers.pop();
            ArithExpr<IntSort> left = this.integers.pop();

            switch (comparison.op) {
                case EQ:
                    this.booleans.push(context.mkEq(left, right));
                    break;
                case NE:
                    this.booleans.push(context.mkNot(context.mkEq(left, right)));
                    break;
                case LT:
                    this.booleans.push(context.mkLt(left, right));
                    break;
                case LE:
                    this.booleans.push(context.mkLe(left, right));
                    break;
                case GT:
                    this.booleans.push(context.mkGt(left, right));
                    break;
                case GE:
                    this.booleans.push(context.mkGe(left, right));
                    break;
                default:
                    throw new UnsupportedOperationException("Unsupported comparison '" + comparison.op + "'.");
            }
        }

        @Override
        public void visit(ArithmeticOperation operation) {
            operation.left.accept(this);
            operation.right.accept(this);
            ArithExpr<IntSort> right = this.integers.pop();
            ArithExpr<IntSort> left = this.integers.pop();

            switch (operation.op) {
                case PLUS:
                    this.integers.push(context.mkAdd(left, right));
                    break;
                case MINUS:
                    this.integers.push(context.mkSub(left, right));
                    break;
                default:
                    throw new UnsupportedOperationException("Unsupported arithmetic operator '" + operation.op + "'.");
            }
        }
    }
}
