package com.statecheck.tool;

/**
 * Thrown when a configured result key is not part of a tool's result schema.
 */
public class InvalidResultKeyException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public InvalidResultKeyException(String message) {
        super(message);
    }
}
