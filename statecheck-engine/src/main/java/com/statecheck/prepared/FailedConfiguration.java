package com.statecheck.prepared;

import com.statecheck.model.Configuration;
import com.statecheck.model.Result;

/**
 * A configuration (or a single comparison of it) that could not be bound to live resources.
 */
public class FailedConfiguration implements PreparedLeaf {
    private final PreparedConfiguration parent;
    private final Configuration config;
    private final Result reason;
    private final Exception exception;

    /**
     * Create a failure record.
     *
     * @param parent prepared node the failure is recorded under (may be null)
     * @param config configuration that failed
     * @param reason failure result
     * @param exception underlying error (may be null)
     */
    public FailedConfiguration(PreparedConfiguration parent, Configuration config, Result reason, Exception exception) {
        this.parent = parent;
        this.config = config;
        this.reason = reason;
        this.exception = exception;
    }

    public PreparedConfiguration getParent() {
        return parent;
    }

    public Configuration getConfig() {
        return config;
    }

    public Result getReason() {
        return reason;
    }

    public Exception getException() {
        return exception;
    }

    @Override
    public Result getResult() {
        return reason;
    }

    @Override
    public String toString() {
        return "FailedConfiguration{config=" + (config != null ? config.getName() : null)
                + ", reason=" + (reason != null ? reason.getReason() : null) + "}";
    }
}
