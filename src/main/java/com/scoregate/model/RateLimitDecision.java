package com.scoregate.model;

public record RateLimitDecision(boolean limited, Long retryAfterSeconds) {

    private static final RateLimitDecision ALLOWED = new RateLimitDecision(false, null);

    public static RateLimitDecision allowed() {
        return ALLOWED;
    }

    public static RateLimitDecision limited(long retryAfterSeconds) {
        return new RateLimitDecision(true, retryAfterSeconds);
    }
}
