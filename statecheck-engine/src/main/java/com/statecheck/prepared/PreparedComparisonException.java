package com.statecheck.prepared;

import com.statecheck.check.Comparison;

/**
 * Thrown when a single comparison cannot be bound to its data source.
 */
public class PreparedComparisonException extends Exception {
    private final String identifier;
    private final transient Comparison comparison;
    private final String name;

    public PreparedComparisonException(String message, String identifier, Comparison comparison, String name) {
        super(message);
        this.identifier = identifier;
        this.comparison = comparison;
        this.name = name;
    }

    public PreparedComparisonException(String message, Throwable cause, String identifier, Comparison comparison, String name) {
        super(message, cause);
        this.identifier = identifier;
        this.comparison = comparison;
        this.name = name;
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
}
