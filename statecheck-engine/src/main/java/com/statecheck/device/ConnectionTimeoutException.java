package com.statecheck.device;

/**
 * Thrown when a data source cannot be connected to or does not answer in time.
 *
 * <p>Leaves map this to the comparison's disconnected severity rather than an internal error.
 */
public class ConnectionTimeoutException extends RuntimeException {
    public ConnectionTimeoutException(String message) {
        super(message);
    }

    public ConnectionTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
