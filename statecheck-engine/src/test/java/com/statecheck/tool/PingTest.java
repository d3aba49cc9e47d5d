package com.statecheck.tool;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PingTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(2);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void reportsAliveAndUnresponsiveHosts() {
        Ping ping = new Ping();
        ping.setHosts(List.of("up", "down", "broken"));
        ping.setCount(2);
        ping.setProber((host, timeout) -> {
            if ("broken".equals(host)) {
                throw new IOException("no route");
            }
            return "up".equals(host) ? 4.0 : null;
        });

        ToolResult result = ping.run(executor).join();

        assertEquals(List.of("up"), result.lookup("alive"));
        assertEquals(1, result.lookup("num_alive"));
        assertEquals(List.of("down", "broken"), result.lookup("unresponsive"));
        assertEquals(2, result.lookup("num_unresponsive"));
        assertEquals(Map.of("up", 4.0), result.lookup("times"));
        assertEquals(4.0, result.lookup("times.up"));
        assertEquals(4.0, result.lookup("max_time"));
    }

    @Test
    void checksResultKeys() {
        Ping ping = new Ping();
        assertDoesNotThrow(() -> ping.checkResultKey("times.host1"));
        assertThrows(InvalidResultKeyException.class, () -> ping.checkResultKey("latency"));
        assertThrows(InvalidResultKeyException.class, () -> ping.checkResultKey(" "));
    }

    @Test
    void equalitySkipsProber() {
        Ping a = new Ping();
        a.setHosts(List.of("h"));
        Ping b = new Ping();
        b.setHosts(List.of("h"));
        b.setProber((host, timeout) -> 1.0);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());

        b.setCount(5);
        assertNotEquals(a, b);
    }
}
