package com.scoregate.exception;

/**
 * Exception thrown when a counter, replay-guard or database store cannot be reached.
 * Treated as a transient failure: the request fails soft and may be retried.
 */
public class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
