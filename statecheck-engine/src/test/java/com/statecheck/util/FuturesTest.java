package com.statecheck.util;

import com.statecheck.device.ConnectionTimeoutException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FuturesTest {

    @Test
    void unwrapsNestedWrappers() {
        IllegalStateException cause = new IllegalStateException("x");
        Throwable wrapped = new CompletionException(new ExecutionException(cause));
        assertSame(cause, Futures.unwrap(wrapped));
    }

    @Test
    void classifiesDisconnects() {
        assertTrue(Futures.isDisconnect(new CompletionException(new ConnectionTimeoutException("gone"))));
        assertTrue(Futures.isDisconnect(new TimeoutException()));
        assertFalse(Futures.isDisconnect(new CompletionException(new IllegalArgumentException("bad"))));
    }
}
