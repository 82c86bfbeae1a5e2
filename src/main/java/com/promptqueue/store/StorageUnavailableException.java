package com.promptqueue.store;

import java.nio.file.Path;

/**
 * Exception thrown when the storage directory cannot be used at all.
 *
 * <p>This is fatal at startup: a missing, non-directory or unwritable storage
 * location stops the scheduler before it loads anything.</p>
 *
 * @see JobStore#open(Path)
 */
public class StorageUnavailableException extends RuntimeException {

    private final Path location;

    /**
     * Create a new StorageUnavailableException.
     *
     * @param message the error message
     * @param location the storage directory that was rejected
     */
    public StorageUnavailableException(String message, Path location) {
        super(message + ": " + location);
        this.location = location;
    }

    /**
     * Create a new StorageUnavailableException with a cause.
     *
     * @param message the error message
     * @param location the storage directory that was rejected
     * @param cause the underlying cause
     */
    public StorageUnavailableException(String message, Path location, Throwable cause) {
        super(message + ": " + location, cause);
        this.location = location;
    }

    /**
     * Get the storage directory that could not be used.
     *
     * @return the rejected path
     */
    public Path getLocation() {
        return location;
    }
}
