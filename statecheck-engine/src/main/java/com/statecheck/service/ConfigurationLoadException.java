package com.statecheck.service;

import java.nio.file.Path;

/**
 * Thrown when a configuration file cannot be read or bound.
 */
public class ConfigurationLoadException extends RuntimeException {
    private final Path path;

    public ConfigurationLoadException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
