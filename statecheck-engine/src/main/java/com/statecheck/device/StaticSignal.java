package com.statecheck.device;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * In-memory signal holding a settable value.
 *
 * <p>A disconnected signal fails reads with {@link ConnectionTimeoutException}.
 */
public class StaticSignal implements SignalHandle {
    private final String name;
    private volatile Object value;
    private volatile boolean connected;

    public StaticSignal(String name, Object value) {
        this(name, value, true);
    }

    public StaticSignal(String name, Object value, boolean connected) {
        this.name = Objects.requireNonNull(name, "name");
        this.value = value;
        this.connected = connected;
    }

    /**
     * A signal that never connects.
     *
     * @param name signal name
     * @return disconnected signal
     */
    public static StaticSignal disconnected(String name) {
        return new StaticSignal(name, null, false);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public CompletableFuture<Object> read(boolean asString) {
        if (!connected) {
            return CompletableFuture.failedFuture(new ConnectionTimeoutException("Signal not connected: " + name));
        }
        Object current = value;
        if (asString && current != null) {
            return CompletableFuture.completedFuture(String.valueOf(current));
        }
        return CompletableFuture.completedFuture(current);
    }

    public void setValue(Object value) {
        this.value = value;
    }

    public void setConnected(boolean connected) {
        this.connected = connected;
    }

    @Override
    public String toString() {
        return "StaticSignal[" + name + "]";
    }
}
