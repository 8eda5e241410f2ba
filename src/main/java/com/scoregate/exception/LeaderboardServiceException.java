package com.scoregate.exception;

/**
 * Exception thrown when the external leaderboard refuses or fails an operation.
 * {@code payloadRejected} marks the one error that has a compensating action:
 * the upload is retried without its metadata blob.
 */
public class LeaderboardServiceException extends RuntimeException {
    private final boolean payloadRejected;

    public LeaderboardServiceException(String message) {
        this(message, false, null);
    }

    public LeaderboardServiceException(String message, Throwable cause) {
        this(message, false, cause);
    }

    public LeaderboardServiceException(String message, boolean payloadRejected, Throwable cause) {
        super(message, cause);
        this.payloadRejected = payloadRejected;
    }

    public static LeaderboardServiceException payloadRejected(String message) {
        return new LeaderboardServiceException(message, true, null);
    }

    public boolean isPayloadRejected() {
        return payloadRejected;
    }
}
