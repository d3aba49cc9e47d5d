package com.statecheck.prepared;

import com.statecheck.cache.DataCache;
import com.statecheck.check.Comparison;
import com.statecheck.model.GroupResultMode;
import com.statecheck.model.Result;
import com.statecheck.model.ResultSummarizer;
import com.statecheck.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

/**
 * A terminal configuration whose children are comparison leaves.
 *
 * @param <T> leaf type
 */
public abstract class PreparedCheckConfiguration<T extends PreparedComparison> extends PreparedConfiguration {
    private static final Logger log = LoggerFactory.getLogger(PreparedCheckConfiguration.class);

    private final List<T> comparisons = new ArrayList<>();

    protected PreparedCheckConfiguration(DataCache cache, PreparedGroup parent) {
        super(cache, parent);
    }

    public List<T> getComparisons() {
        return Collections.unmodifiableList(comparisons);
    }

    @Override
    public Stream<PreparedLeaf> walkComparisons() {
        return Stream.concat(getPrepareFailures().stream(), comparisons.stream());
    }

    @Override
    Result fold() {
        List<Object> results = new ArrayList<>(comparisons.size());
        for (T comparison : comparisons) {
            results.add(comparison.getResult());
        }

        Result folded;
        if (!getPrepareFailures().isEmpty()) {
            folded = Result.of(Severity.ERROR, INITIALIZATION_FAILURE);
        } else {
            folded = Result.of(ResultSummarizer.summarize(GroupResultMode.ALL, results), null);
        }
        setResult(folded);
        return folded;
    }

    /**
     * Binds one leaf, recording a failure instead of propagating it.
     */
    void addComparison(String identifier, Comparison comparison, ComparisonBinder<T> binder) {
        try {
            comparisons.add(binder.bind());
        } catch (Exception ex) {
            log.warn("Failed to prepare comparison: config={}, identifier={}, reason={}",
                    displayName(getConfig()), identifier, ex.getMessage());
            recordFailure(new FailedConfiguration(
                    this,
                    getConfig(),
                    Result.of(Severity.ERROR, "Failed to prepare comparison for " + identifier + ": " + ex.getMessage()),
                    ex
            ));
        }
    }

    /**
     * The comparisons of one identifier followed by the shared ones.
     */
    static List<Comparison> withShared(List<Comparison> comparisons, List<Comparison> shared) {
        List<Comparison> out = new ArrayList<>();
        if (comparisons != null) {
            out.addAll(comparisons);
        }
        if (shared != null) {
            out.addAll(shared);
        }
        return out;
    }

    @FunctionalInterface
    interface ComparisonBinder<T> {
        T bind() throws PreparedComparisonException;
    }
}
