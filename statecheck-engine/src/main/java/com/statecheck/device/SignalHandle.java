package com.statecheck.device;

import java.util.concurrent.CompletableFuture;

/**
 * A live, readable data source.
 *
 * <p>Handles are consumed only through the data cache.
 */
public interface SignalHandle {

    String getName();

    /**
     * Reads the current value.
     *
     * <p>The future completes with {@link ConnectionTimeoutException} when the source cannot be
     * reached. A {@code null} value means the source is connected but has no data.
     *
     * @param asString read the value as a string
     * @return the value
     */
    CompletableFuture<Object> read(boolean asString);
}
