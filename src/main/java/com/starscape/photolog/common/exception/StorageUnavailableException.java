package com.starscape.photolog.common.exception;

/**
 * A blob or metadata backend could not complete an operation: I/O error, timeout,
 * throttling or an unexpected service response. Stores never retry; callers decide.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
