package com.scoregate.exception;

public class AdminAccessDeniedException extends RuntimeException {
    public AdminAccessDeniedException(String message) {
        super(message);
    }

    public AdminAccessDeniedException(String message, Throwable cause) {
        super(message, cause);
    }
}
