package com.statecheck.tool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured result of a tool run, addressed by (dotted) keys.
 */
public class ToolResult {
    private final Map<String, Object> values;

    public ToolResult(Map<String, Object> values) {
        this.values = values != null ? Collections.unmodifiableMap(new LinkedHashMap<>(values)) : Map.of();
    }

    public Map<String, Object> getValues() {
        return values;
    }

    /**
     * Looks up a value. Dots descend into nested maps; at each level the longest matching key wins,
     * so keys that themselves contain dots (host addresses) still resolve.
     *
     * @param key result key
     * @return value, possibly {@code null}
     * @throws ResultKeyNotFoundException if the key does not exist
     */
    public Object lookup(String key) {
        if (key == null) {
            throw new ResultKeyNotFoundException("null");
        }
        return lookup(values, key, key);
    }

    private static Object lookup(Map<?, ?> map, String remaining, String fullKey) {
        if (map.containsKey(remaining)) {
            return map.get(remaining);
        }

        int dot = remaining.indexOf('.');
        while (dot > 0) {
            String head = remaining.substring(0, dot);
            if (map.containsKey(head)) {
                Object child = map.get(head);
                if (child instanceof Map<?, ?> childMap) {
                    return lookup(childMap, remaining.substring(dot + 1), fullKey);
                }
                break;
            }
            dot = remaining.indexOf('.', dot + 1);
        }
        throw new ResultKeyNotFoundException(fullKey);
    }

    @Override
    public String toString() {
        return "ToolResult" + values;
    }
}
