package com.statecheck.model;

import lombok.Value;

import java.time.Instant;

/**
 * Outcome of a comparison or of an aggregated group.
 */
@Value
public class Result {
    Severity severity;
    String reason;
    Instant timestamp;

    public static Result success() {
        return new Result(Severity.SUCCESS, null, Instant.now());
    }

    public static Result of(Severity severity, String reason) {
        return new Result(severity != null ? severity : Severity.INTERNAL_ERROR, reason, Instant.now());
    }

    /**
     * Builds an internal error result describing an unexpected exception.
     *
     * @param ex exception
     * @return result with severity {@link Severity#INTERNAL_ERROR}
     */
    public static Result fromException(Throwable ex) {
        return of(Severity.INTERNAL_ERROR, ex.getClass().getSimpleName() + ": " + ex.getMessage());
    }
}
