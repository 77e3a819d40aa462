package guards.domain;

import java.util.HashMap;
import java.util.Map;

public enum Operator implements Model {

    EQ("==", Category.COMPARISON),
    NE("!=", Category.COMPARISON),
    LT("<", Category.COMPARISON),
    LE("<=", Category.COMPARISON),
    GT(">", Category.COMPARISON),
    GE(">=", Category.COMPARISON),

    PLUS("+", Category.ARITHMETIC),
    MINUS("-", Category.ARITHMETIC),

    AND("&&", Category.CONNECTIVE),
    OR("||", Category.CONNECTIVE),
    IMPLIES("->", Category.CONNECTIVE),
    // Only built by the equivalence checker, never parsed.
    XOR("^", Category.CONNECTIVE);

    public enum Category {
        COMPARISON,
        ARITHMETIC,
        CONNECTIVE
    }

    private final String symbol;
    private final Category category;

    private static final Map<String, Operator> lookup = new HashMap<String, Operator>();

    static {
        for (Operator op : Operator.values()) {
            lookup.put(op.symbol, op);
        }
    }

    Operator(final String symbol, final Category category) {
        this.symbol = symbol;
        this.category = category;
    }

    public static Operator get(String symbol) {
        return lookup.get(symbol.trim());
    }

    public boolean is(Category category) {
        return this.category == category;
    }

    @Override
    public void accept(ModelVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
