package com.statecheck.tool;

/**
 * Thrown when a key is missing from a tool result.
 */
public class ResultKeyNotFoundException extends RuntimeException {
    private final String key;

    /**
     * Create a new exception.
     *
     * @param key missing key
     */
    public ResultKeyNotFoundException(String key) {
        super("Result key not found: " + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
