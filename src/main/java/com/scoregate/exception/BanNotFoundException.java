package com.scoregate.exception;

/**
 * Exception thrown when an operator looks up or lifts a ban that does not exist.
 */
public class BanNotFoundException extends RuntimeException {
    public BanNotFoundException(String message) {
        super(message);
    }

    public BanNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
