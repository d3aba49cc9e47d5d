package com.statecheck.prepared;

import com.statecheck.cache.DataCache;
import com.statecheck.check.Comparison;
import com.statecheck.model.Result;
import com.statecheck.model.Severity;
import com.statecheck.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * A comparison bound to its data source: one identifier, one predicate.
 */
public abstract class PreparedComparison implements PreparedLeaf {
    private static final Logger log = LoggerFactory.getLogger(PreparedComparison.class);

    private final DataCache cache;
    private final String identifier;
    private final Comparison comparison;
    private final String name;
    private final PreparedConfiguration parent;
    private volatile Result result;
    private volatile Object data;

    protected PreparedComparison(
            DataCache cache,
            String identifier,
            Comparison comparison,
            String name,
            PreparedConfiguration parent
    ) {
        this.cache = cache;
        this.identifier = identifier;
        this.comparison = comparison;
        this.name = name;
        this.parent = parent;
    }

    /**
     * Acquires the value to compare, through the shared cache.
     *
     * @return future of the value
     */
    public abstract CompletableFuture<?> getDataAsync();

    /**
     * Runs the predicate against acquired data.
     */
    protected abstract Result compareData(Object data);

    /**
     * Acquires data and runs the predicate. The returned future never completes exceptionally;
     * every failure becomes the stored {@link Result}.
     *
     * @return this comparison's result
     */
    public CompletableFuture<Result> compare() {
        return compare(new ComparisonPass());
    }

    /**
     * Runs within a pass. Nothing starts once the pass is closed, and an outcome arriving after
     * the close is returned but not stored.
     */
    CompletableFuture<Result> compare(ComparisonPass pass) {
        if (!pass.isOpen()) {
            return CompletableFuture.completedFuture(result);
        }

        CompletableFuture<?> acquisition;
        try {
            acquisition = getDataAsync();
        } catch (RuntimeException e) {
            acquisition = CompletableFuture.failedFuture(e);
        }

        return acquisition.handle((value, ex) -> {
            Result outcome = ex != null ? acquisitionFailure(ex) : runPredicate(value);
            boolean stored = pass.writeIfOpen(() -> {
                if (ex == null) {
                    data = value;
                }
                result = outcome;
            });
            if (!stored) {
                log.debug("Discarding late result: identifier={}, severity={}", identifier, outcome.getSeverity());
            }
            return outcome;
        });
    }

    private Result acquisitionFailure(Throwable ex) {
        Throwable cause = Futures.unwrap(ex);
        if (Futures.isDisconnect(cause)) {
            log.warn("Unable to retrieve data: identifier={}, reason={}", identifier, cause.getMessage());
            return Result.of(comparison.getIfDisconnected(),
                    "Unable to retrieve data for comparison: " + identifier);
        }
        log.error("Failed to get data: identifier={}", identifier, cause);
        return Result.of(Severity.INTERNAL_ERROR,
                "Getting data for '" + identifier + "' comparison " + comparison.describe()
                        + " raised " + cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }

    private Result runPredicate(Object value) {
        try {
            return compareData(value);
        } catch (RuntimeException e) {
            log.error("Comparison raised: identifier={}", identifier, e);
            return Result.of(Severity.INTERNAL_ERROR,
                    "Failed to run '" + identifier + "' comparison " + comparison.describe()
                            + " raised " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    void resetResult() {
        result = null;
    }

    public DataCache getCache() {
        return cache;
    }

    public String getIdentifier() {
        return identifier;
    }

    public Comparison getComparison() {
        return comparison;
    }

    public String getName() {
        return name;
    }

    public PreparedConfiguration getParent() {
        return parent;
    }

    /**
     * @return the last result, or {@code null} if this comparison has not run
     */
    @Override
    public Result getResult() {
        return result;
    }

    /**
     * @return the last acquired value
     */
    public Object getData() {
        return data;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{identifier=" + identifier + ", comparison=" + comparison.describe() + "}";
    }
}
