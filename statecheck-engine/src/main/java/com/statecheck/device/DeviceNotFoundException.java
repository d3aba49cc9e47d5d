package com.statecheck.device;

/**
 * Thrown when a device cannot be resolved by name.
 */
public class DeviceNotFoundException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public DeviceNotFoundException(String message) {
        super(message);
    }
}
