package com.statecheck.prepared;

/**
 * Signals that a whole configuration node could not be prepared.
 *
 * <p>The enclosing group records {@link #getFailure()} and carries on with its other children.
 */
public class PreparationFailedException extends Exception {
    private final transient FailedConfiguration failure;

    public PreparationFailedException(FailedConfiguration failure) {
        super(failure.getReason() != null ? failure.getReason().getReason() : "configuration failed to prepare",
                failure.getException());
        this.failure = failure;
    }

    public FailedConfiguration getFailure() {
        return failure;
    }
}
