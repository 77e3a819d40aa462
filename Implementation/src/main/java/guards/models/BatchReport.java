package guards.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public class BatchReport {
    private final List<PairResult> results;

    public BatchReport(List<PairResult> results) {
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
    }

    public List<PairResult> getResults() {
        return this.results;
    }

    /**
     * @return the non-equivalent and errored pairs, in input order.
     */
    public List<PairResult> getProblems() {
        return this.results.stream().filter(PairResult::isProblem).collect(Collectors.toList());
    }

    public int getTotalCount() {
        return this.results.size();
    }

    public int getEquivalentCount() {
        return this.count(Classification.EQ);
    }

    public int getNotEquivalentCount() {
        return this.count(Classification.NEQ);
    }

    public int getErrorCount() {
        return this.count(Classification.ERROR);
    }

    private int count(Classification classification) {
        return (int) this.results.stream().filter(r -> r.verdict.result == classification).count();
    }
}
