package com.statecheck.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Locale;

/**
 * Outcome level of a check, ordered from best to worst.
 *
 * <p>Aggregation relies on the declaration order: {@code SUCCESS < WARNING < ERROR < INTERNAL_ERROR}.
 */
public enum Severity {
    SUCCESS,
    WARNING,
    ERROR,
    INTERNAL_ERROR;

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromJson(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("severity is blank");
        }
        return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Returns the worst severity of the given values, or {@link #SUCCESS} when empty.
     *
     * @param severities severities
     * @return maximum severity
     */
    public static Severity maximum(Collection<Severity> severities) {
        Severity out = SUCCESS;
        for (Severity s : severities) {
            if (s != null && s.compareTo(out) > 0) {
                out = s;
            }
        }
        return out;
    }

    /**
     * Returns the best severity of the given values, or {@link #SUCCESS} when empty.
     *
     * @param severities severities
     * @return minimum severity
     */
    public static Severity minimum(Collection<Severity> severities) {
        Severity out = null;
        for (Severity s : severities) {
            if (s != null && (out == null || s.compareTo(out) < 0)) {
                out = s;
            }
        }
        return out != null ? out : SUCCESS;
    }
}
