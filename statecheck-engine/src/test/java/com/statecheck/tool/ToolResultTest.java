package com.statecheck.tool;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ToolResultTest {

    private final ToolResult result = new ToolResult(Map.of(
            "num_alive", 2,
            "alive", List.of("a", "b"),
            "times", Map.of("10.0.0.1", 1.5, "host", 2.0),
            "empty", new HashMap<String, Object>()
    ));

    @Test
    void topLevelKey() {
        assertEquals(2, result.lookup("num_alive"));
    }

    @Test
    void nestedKeyWithDotsInName() {
        assertEquals(1.5, result.lookup("times.10.0.0.1"));
        assertEquals(2.0, result.lookup("times.host"));
    }

    @Test
    void missingKeyRaises() {
        ResultKeyNotFoundException ex = assertThrows(ResultKeyNotFoundException.class,
                () -> result.lookup("times.10.0.0.2"));
        assertEquals("times.10.0.0.2", ex.getKey());
        assertThrows(ResultKeyNotFoundException.class, () -> result.lookup("num_alive.x"));
    }

    @Test
    void nullValueIsReturned() {
        HashMap<String, Object> values = new HashMap<>();
        values.put("value", null);
        assertNull(new ToolResult(values).lookup("value"));
    }
}
