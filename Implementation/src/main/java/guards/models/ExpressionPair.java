package guards.models;

import java.util.Objects;

public class ExpressionPair {
    // 1-based position in the pair store.
    public final int index;
    public final String original;
    public final String simplified;

    public ExpressionPair(int index, String original, String simplified) {
        this.index = index;
        this.original = original;
        this.simplified = simplified;
    }

    @Override
    public String toString() {
        return "Pair " + this.index + ": " + this.original + " <=> " + this.simplified;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExpressionPair that = (ExpressionPair) o;
        return index == that.index
            && Objects.equals(original, that.original)
            && Objects.equals(simplified, that.simplified);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, original, simplified);
    }
}
