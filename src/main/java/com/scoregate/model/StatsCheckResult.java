package com.scoregate.model;

public record StatsCheckResult(
        boolean valid,
        StatsViolation violation,
        String detail) {

    private static final StatsCheckResult VALID = new StatsCheckResult(true, null, null);

    public static StatsCheckResult ok() {
        return VALID;
    }

    public static StatsCheckResult reject(StatsViolation violation, String detail) {
        return new StatsCheckResult(false, violation, detail);
    }

    /** Reason string for logs and detailed responses, e.g. {@code ROUND_TIME_TOO_SHORT: round 1 ...}. */
    public String reason() {
        if (valid) {
            return null;
        }
        return detail == null ? violation.name() : violation.name() + ": " + detail;
    }
}
