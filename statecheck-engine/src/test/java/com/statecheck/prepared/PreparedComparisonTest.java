package com.statecheck.prepared;

import com.statecheck.cache.DataCache;
import com.statecheck.check.Equals;
import com.statecheck.check.Range;
import com.statecheck.device.SignalHandle;
import com.statecheck.device.SimpleDeviceHandle;
import com.statecheck.device.StaticSignal;
import com.statecheck.device.StaticSignalRegistry;
import com.statecheck.model.Result;
import com.statecheck.model.Severity;
import com.statecheck.tool.Ping;
import com.statecheck.tool.ToolResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PreparedComparisonTest {

    private ScheduledExecutorService scheduler;
    private StaticSignalRegistry signals;
    private DataCache cache;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newScheduledThreadPool(2);
        signals = new StaticSignalRegistry();
        cache = new DataCache(signals, scheduler, Duration.ofSeconds(2), Duration.ofMillis(10));
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private static Equals equalsTo(Object value) {
        Equals equals = new Equals();
        equals.setValue(value);
        return equals;
    }

    @Test
    void passingComparisonStoresDataAndResult() throws Exception {
        signals.register("PV:OK", 5);
        PreparedSignalComparison leaf = PreparedSignalComparison.fromPvName("PV:OK", equalsTo(5), "check", null, cache);

        Result result = leaf.compare().join();

        assertEquals(Severity.SUCCESS, result.getSeverity());
        assertEquals(result, leaf.getResult());
        assertEquals(5, leaf.getData());
    }

    @Test
    void outcomeAfterPassClosedIsNotStored() throws Exception {
        CompletableFuture<Object> read = new CompletableFuture<>();
        SignalHandle slow = mock(SignalHandle.class);
        when(slow.getName()).thenReturn("SLOW");
        when(slow.read(anyBoolean())).thenReturn(read);
        signals.register(slow);
        PreparedSignalComparison leaf = PreparedSignalComparison.fromPvName("SLOW", equalsTo(5), "check", null, cache);

        ComparisonPass pass = new ComparisonPass();
        CompletableFuture<Result> running = leaf.compare(pass);
        pass.close();
        read.complete(5);

        assertEquals(Severity.SUCCESS, running.join().getSeverity());
        assertNull(leaf.getResult());
        assertNull(leaf.getData());
        assertNull(leaf.compare(pass).join());
    }

    @Test
    void disconnectUsesIfDisconnectedSeverity() throws Exception {
        Equals equals = equalsTo(1);
        equals.setIfDisconnected(Severity.WARNING);
        PreparedSignalComparison leaf = PreparedSignalComparison.fromPvName("PV:GONE", equals, "check", null, cache);

        Result result = leaf.compare().join();

        assertEquals(Severity.WARNING, result.getSeverity());
        assertEquals("Unable to retrieve data for comparison: PV:GONE", result.getReason());
    }

    @Test
    void unexpectedAcquisitionFailureIsInternalError() throws Exception {
        SignalHandle broken = mock(SignalHandle.class);
        when(broken.getName()).thenReturn("BROKEN");
        when(broken.read(anyBoolean())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("bad frame")));
        signals.register(broken);
        PreparedSignalComparison leaf = PreparedSignalComparison.fromPvName("BROKEN", equalsTo(1), "check", null, cache);

        Result result = leaf.compare().join();

        assertEquals(Severity.INTERNAL_ERROR, result.getSeverity());
        assertTrue(result.getReason().contains("raised IllegalStateException: bad frame"), result.getReason());
    }

    @Test
    void missingValueSkipsPredicate() throws Exception {
        signals.register(new StaticSignal("PV:NULL", null));
        Equals equals = equalsTo(1);
        equals.setIfDisconnected(Severity.WARNING);
        Equals predicate = spy(equals);
        PreparedSignalComparison leaf = PreparedSignalComparison.fromPvName("PV:NULL", predicate, "check", null, cache);

        Result result = leaf.compare().join();

        assertEquals(Severity.WARNING, result.getSeverity());
        assertTrue(result.getReason().startsWith("No data available for signal 'PV:NULL'"));
        verify(predicate, never()).compare(any(), any());
    }

    @Test
    void predicateExceptionIsInternalError() throws Exception {
        signals.register("PV:TEXT", "not a number");
        Range range = new Range();
        range.setHigh(1);
        PreparedSignalComparison leaf = PreparedSignalComparison.fromPvName("PV:TEXT", range, "check", null, cache);

        Result result = leaf.compare().join();

        assertEquals(Severity.INTERNAL_ERROR, result.getSeverity());
        assertTrue(result.getReason().startsWith("Failed to run 'PV:TEXT' comparison"), result.getReason());
    }

    @Test
    void missingDeviceAttributeFailsBinding() {
        SimpleDeviceHandle device = new SimpleDeviceHandle("m1");
        PreparedComparisonException ex = assertThrows(PreparedComparisonException.class,
                () -> PreparedSignalComparison.fromDevice(device, "velocity", equalsTo(0), "motors", null, cache));
        assertEquals("m1.velocity", ex.getIdentifier());
        assertEquals("motors", ex.getName());
    }

    @Test
    void deviceAttributeIdentifier() throws Exception {
        SimpleDeviceHandle device = new SimpleDeviceHandle("m1").withSignal("position", new StaticSignal("M1:POS", 2.0));
        PreparedSignalComparison leaf = PreparedSignalComparison.fromDevice(device, "position", equalsTo(2.0), "motors", null, cache);
        assertEquals("m1.position", leaf.getIdentifier());
        assertEquals(Severity.SUCCESS, leaf.compare().join().getSeverity());
    }

    @Test
    void invalidToolKeyFailsBinding() {
        assertThrows(PreparedComparisonException.class,
                () -> PreparedToolComparison.fromTool(new Ping(), "latency", equalsTo(0), "ping", null, cache));
    }

    @Test
    void missingToolResultKeyUsesFailureSeverity() throws Exception {
        Ping ping = new Ping();
        ping.setHosts(List.of("h1"));
        ping.setCount(1);
        ping.setProber((host, timeout) -> 1.0);
        Equals equals = equalsTo(1.0);
        equals.setSeverityOnFailure(Severity.WARNING);
        PreparedToolComparison leaf = PreparedToolComparison.fromTool(ping, "times.h2", equals, "ping", null, cache);

        Result result = leaf.compare().join();

        assertEquals(Severity.WARNING, result.getSeverity());
        assertTrue(result.getReason().startsWith("Provided key is invalid for tool result"));
    }

    @Test
    void toolKeyIsCompared() throws Exception {
        Ping ping = new Ping();
        ping.setHosts(List.of("h1", "h2"));
        ping.setCount(1);
        ping.setProber((host, timeout) -> "h1".equals(host) ? 1.0 : null);
        PreparedToolComparison leaf = PreparedToolComparison.fromTool(ping, "num_alive", equalsTo(2), "ping", null, cache);

        Result result = leaf.compare().join();

        assertEquals(Severity.ERROR, result.getSeverity());
        assertEquals(1, ((ToolResult) leaf.getData()).lookup("num_alive"));
    }

    @Test
    void resultIsUnsetBeforeFirstRun() throws Exception {
        PreparedSignalComparison leaf = PreparedSignalComparison.fromPvName("PV:X", equalsTo(1), "check", null, cache);
        assertNull(leaf.getResult());
        assertEquals(Severity.INTERNAL_ERROR, PreparedLeaf.resultOf(leaf).getSeverity());
    }
}
