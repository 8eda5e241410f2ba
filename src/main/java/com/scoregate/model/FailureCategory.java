package com.scoregate.model;

public enum FailureCategory {
    /** Store or network failure. Safe to retry. */
    TRANSIENT,
    /** Missing or malformed required fields. */
    STRUCTURAL,
    /** Bad ticket, identity mismatch, missing entitlement, bad or reused token. */
    AUTHENTICATION,
    /** Rate limited or already banned. */
    POLICY,
    /** Statistics outside the configured bounds. */
    PLAUSIBILITY,
    /** The external leaderboard refused or failed. */
    UPSTREAM
}
