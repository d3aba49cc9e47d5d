package com.statecheck.util;

import com.statecheck.device.ConnectionTimeoutException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Helpers for failures surfacing through {@link java.util.concurrent.CompletableFuture}.
 */
public final class Futures {
    private Futures() {
    }

    /**
     * Strips the {@link CompletionException}/{@link ExecutionException} wrappers added by dependent stages.
     *
     * @param ex exception as observed by a callback
     * @return the underlying failure
     */
    public static Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Whether a failure means the source could not be reached in time, as opposed to a fault.
     *
     * @param ex failure (wrapped or not)
     * @return true for connection and timeout failures
     */
    public static boolean isDisconnect(Throwable ex) {
        Throwable cause = unwrap(ex);
        return cause instanceof ConnectionTimeoutException || cause instanceof TimeoutException;
    }
}
