package com.statecheck.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds child results into one severity according to a {@link GroupResultMode}.
 */
public final class ResultSummarizer {
    private ResultSummarizer() {
    }

    /**
     * Summarizes results.
     *
     * <p>Entries may be {@link Result}, {@link Throwable} or {@code null}. A missing or exceptional
     * entry forces {@link Severity#ERROR}. An unknown mode yields {@link Severity#INTERNAL_ERROR}.
     *
     * @param mode group mode
     * @param results child results
     * @return combined severity
     */
    public static Severity summarize(GroupResultMode mode, List<?> results) {
        List<Severity> severities = new ArrayList<>(results.size());
        for (Object entry : results) {
            if (entry instanceof Result r) {
                severities.add(r.getSeverity());
            } else {
                // null, an exception, or anything that is not a result
                return Severity.ERROR;
            }
        }

        if (mode == GroupResultMode.ALL) {
            return Severity.maximum(severities);
        }
        if (mode == GroupResultMode.ANY) {
            return Severity.minimum(severities);
        }
        return Severity.INTERNAL_ERROR;
    }
}
