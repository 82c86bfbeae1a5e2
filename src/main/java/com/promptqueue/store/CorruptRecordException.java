package com.promptqueue.store;

import java.io.IOException;

/**
 * Thrown when a stored job record cannot be parsed back into a job.
 * The store quarantines such records instead of failing the whole load.
 */
public class CorruptRecordException extends IOException {

    public CorruptRecordException(String message) {
        super(message);
    }

    public CorruptRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
