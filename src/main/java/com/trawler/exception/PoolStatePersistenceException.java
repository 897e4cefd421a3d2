package com.trawler.exception;

import java.nio.file.Path;

/**
 * Exception thrown when a pool snapshot cannot be written
 */
public class PoolStatePersistenceException extends RuntimeException {

    private final Path location;

    public PoolStatePersistenceException(Path location, String message, Throwable cause) {
        super(String.format("%s (%s)", message, location), cause);
        this.location = location;
    }

    public Path getLocation() {
        return location;
    }
}
