package guards.simplification;

import guards.models.ExpressionPair;
import guards.naming.NameMapping;
import guards.repositories.ExpressionPairRepository;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Pairs original expressions with their simplified form and appends them to
 * a pair store.
 */
public class PairCollector {
    private final FormulaSimplifier simplifier;
    private final NameMapping names;

    public PairCollector(FormulaSimplifier simplifier) {
        this(simplifier, NameMapping.empty());
    }

    /**
     * @param names applied to both halves of each pair, so short names the
     *              simplifier worked on are expanded back to the originals.
     */
    public PairCollector(FormulaSimplifier simplifier, NameMapping names) {
        this.simplifier = simplifier;
        this.names = names;
    }

    public List<ExpressionPair> collect(List<String> originals) {
        List<ExpressionPair> pairs = new ArrayList<>();
        int index = 0;
        for (String original : originals) {
            index++;
            if (StringUtils.isBlank(original)) {
                continue;
            }

            String simplified;
            try {
                simplified = this.simplifier.simplify(original);
            } catch (SimplificationException | RuntimeException e) {
                System.err.println("Skipping expression " + index + ": " + ExceptionUtils.getRootCauseMessage(e));
                continue;
            }

            pairs.add(new ExpressionPair(
                pairs.size() + 1,
                this.names.expand(original),
                this.names.expand(simplified)
            ));
        }
        return pairs;
    }

    public List<ExpressionPair> collect(List<String> originals, Path store) throws IOException {
        List<ExpressionPair> pairs = this.collect(originals);
        ExpressionPairRepository.append(store, pairs);
        return pairs;
    }
}
