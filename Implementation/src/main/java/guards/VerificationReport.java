package guards;

import java.util.List;

/**
 * The persisted form of a batch run, shared by the text and JSON reports.
 */
public class VerificationReport {
    private final int total;
    private final int equivalent;
    private final int nonEquivalent;
    private final int errors;
    private final List<Problem> problems;

    public VerificationReport(int total, int equivalent, int nonEquivalent, int errors, List<Problem> problems) {
        this.total = total;
        this.equivalent = equivalent;
        this.nonEquivalent = nonEquivalent;
        this.errors = errors;
        this.problems = problems;
    }

    public int getTotal() {
        return total;
    }

    public int getEquivalent() {
        return equivalent;
    }

    public int getNonEquivalent() {
        return nonEquivalent;
    }

    public int getErrors() {
        return errors;
    }

    public List<Problem> getProblems() {
        return problems;
    }

    public static class Problem {
        private final int index;
        private final String original;
        private final String simplified;
        private final String result;
        private final List<Assignment> counterexample;
        private final String error;

        public Problem(int index, String original, String simplified, String result, List<Assignment> counterexample, String error) {
            this.index = index;
            this.original = original;
            this.simplified = simplified;
            this.result = result;
            this.counterexample = counterexample;
            this.error = error;
        }

        public int getIndex() {
            return index;
        }

        public String getOriginal() {
            return original;
        }

        public String getSimplified() {
            return simplified;
        }

        public String getResult() {
            return result;
        }

        public List<Assignment> getCounterexample() {
            return counterexample;
        }

        public String getError() {
            return error;
        }
    }

    public static class Assignment {
        private final String variable;
        private final String value;
        // Only set if the variable is a short name with a known original.
        private final String originalName;

        public Assignment(String variable, String value, String originalName) {
            this.variable = variable;
            this.value = value;
            this.originalName = originalName;
        }

        public String getVariable() {
            return variable;
        }

        public String getValue() {
            return value;
        }

        public String getOriginalName() {
            return originalName;
        }
    }
}
