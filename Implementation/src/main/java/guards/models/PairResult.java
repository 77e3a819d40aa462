package guards.models;

public class PairResult {
    public final ExpressionPair pair;
    public final Verdict verdict;
    // Seconds.
    public final Float runtime;

    public PairResult(ExpressionPair pair, Verdict verdict, Float runtime) {
        this.pair = pair;
        this.verdict = verdict;
        this.runtime = runtime;
    }

    public boolean isProblem() {
        return !this.verdict.isEquivalent();
    }
}
