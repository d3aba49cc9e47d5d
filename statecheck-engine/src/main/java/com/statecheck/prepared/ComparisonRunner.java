package com.statecheck.prepared;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Fans an action out over prepared comparisons, concurrently or one after the other.
 *
 * <p>Each action's failure is absorbed here so that it never fails the join or its siblings.
 */
final class ComparisonRunner {
    private static final Logger log = LoggerFactory.getLogger(ComparisonRunner.class);

    private ComparisonRunner() {
    }

    static CompletableFuture<Void> run(
            List<PreparedComparison> comparisons,
            boolean parallel,
            Function<PreparedComparison, CompletableFuture<?>> action
    ) {
        if (parallel) {
            CompletableFuture<?>[] started = comparisons.stream()
                    .map(c -> start(c, action))
                    .toArray(CompletableFuture[]::new);
            return CompletableFuture.allOf(started);
        }

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (PreparedComparison comparison : comparisons) {
            chain = chain.thenCompose(ignored -> start(comparison, action));
        }
        return chain;
    }

    private static CompletableFuture<Void> start(
            PreparedComparison comparison,
            Function<PreparedComparison, CompletableFuture<?>> action
    ) {
        CompletableFuture<?> future;
        try {
            future = action.apply(comparison);
        } catch (RuntimeException e) {
            log.error("Comparison action failed to start: identifier={}", comparison.getIdentifier(), e);
            return CompletableFuture.completedFuture(null);
        }
        return future.handle((value, ex) -> {
            if (ex != null) {
                log.debug("Comparison action failed: identifier={}", comparison.getIdentifier(), ex);
            }
            return (Void) null;
        });
    }
}
