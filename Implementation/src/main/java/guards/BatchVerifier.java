package guards;

import guards.models.BatchReport;
import guards.models.ExpressionPair;
import guards.models.PairResult;
import guards.models.Verdict;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.apache.commons.lang3.time.StopWatch;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

/**
 * Verifies a sequence of pairs. Each pair is verified independently, and a
 * pair that fails only produces an error verdict for itself.
 */
public class BatchVerifier {
    private final PairVerifier verifier;
    private final int workers;

    public interface Listener {
        void pairVerified(PairResult result, int completed, int total);
    }

    public BatchVerifier(PairVerifier verifier) {
        this(verifier, 1);
    }

    public BatchVerifier(PairVerifier verifier, int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("At least one worker is required, got " + workers + ".");
        }
        this.verifier = verifier;
        this.workers = workers;
    }

    public BatchReport run(List<ExpressionPair> pairs) {
        return this.run(pairs, (result, completed, total) -> { });
    }

    public BatchReport run(List<ExpressionPair> pairs, Listener listener) {
        if (this.workers == 1 || pairs.size() < 2) {
            return this.runSequentially(pairs, listener);
        }
        return this.runInParallel(pairs, listener);
    }

    private BatchReport runSequentially(List<ExpressionPair> pairs, Listener listener) {
        List<PairResult> results = new ArrayList<>();
        for (ExpressionPair pair : pairs) {
            PairResult result = this.verify(pair);
            results.add(result);
            listener.pairVerified(result, results.size(), pairs.size());
        }
        return new BatchReport(results);
    }

    private BatchReport runInParallel(List<ExpressionPair> pairs, Listener listener) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(this.workers, pairs.size()));
        CompletionService<PairResult> completion = new ExecutorCompletionService<>(executor);

        try {
            List<Future<PairResult>> futures = new ArrayList<>();
            for (ExpressionPair pair : pairs) {
                futures.add(completion.submit(() -> this.verify(pair)));
            }

            // Report progress in completion order, collect results in input order.
            for (int completed = 1; completed <= pairs.size(); completed++) {
                listener.pairVerified(completion.take().get(), completed, pairs.size());
            }

            List<PairResult> results = new ArrayList<>();
            for (int i = 0; i < pairs.size(); i++) {
                results.add(futures.get(i).get());
            }
            return new BatchReport(results);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while verifying pairs.", e);
        } catch (ExecutionException e) {
            // verify() never throws, so this is a bug.
            throw new IllegalStateException(e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private PairResult verify(ExpressionPair pair) {
        StopWatch stopWatch = StopWatch.createStarted();
        Verdict verdict;
        try {
            verdict = this.verifier.verify(pair);
        } catch (RuntimeException e) {
            verdict = Verdict.error(ExceptionUtils.getRootCauseMessage(e));
        }
        stopWatch.stop();
        return new PairResult(pair, verdict, stopWatch.getTime() / 1000f);
    }
}
