package com.scoregate.model;

import org.springframework.http.HttpStatus;

/**
 * Machine-readable classification of a request, written to the audit log and
 * mapped to the HTTP status returned to the client.
 * A hard outcome cannot be produced by an unmodified client and invokes the ban policy.
 */
public enum SubmissionOutcome {
    SUCCESS(HttpStatus.OK, null, false),

    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, FailureCategory.POLICY, false),
    BANNED(HttpStatus.FORBIDDEN, FailureCategory.POLICY, false),

    MISSING_PARAMETERS(HttpStatus.BAD_REQUEST, FailureCategory.STRUCTURAL, false),
    MISSING_FIELDS(HttpStatus.BAD_REQUEST, FailureCategory.STRUCTURAL, true),

    INVALID_TICKET(HttpStatus.FORBIDDEN, FailureCategory.AUTHENTICATION, true),
    IDENTITY_MISMATCH(HttpStatus.FORBIDDEN, FailureCategory.AUTHENTICATION, true),
    NOT_ENTITLED(HttpStatus.FORBIDDEN, FailureCategory.AUTHENTICATION, true),
    MALFORMED_TOKEN(HttpStatus.FORBIDDEN, FailureCategory.AUTHENTICATION, true),
    BAD_TOKEN_SIGNATURE(HttpStatus.FORBIDDEN, FailureCategory.AUTHENTICATION, true),
    TOKEN_EXPIRED(HttpStatus.FORBIDDEN, FailureCategory.AUTHENTICATION, true),
    TOKEN_OWNER_MISMATCH(HttpStatus.FORBIDDEN, FailureCategory.AUTHENTICATION, true),
    TOKEN_REPLAYED(HttpStatus.FORBIDDEN, FailureCategory.AUTHENTICATION, true),

    INVALID_STATS(HttpStatus.BAD_REQUEST, FailureCategory.PLAUSIBILITY, false),

    TICKET_VALIDATION_FAILED(HttpStatus.SERVICE_UNAVAILABLE, FailureCategory.TRANSIENT, false),
    STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, FailureCategory.TRANSIENT, false),
    LEADERBOARD_ERROR(HttpStatus.BAD_GATEWAY, FailureCategory.UPSTREAM, false);

    private final HttpStatus status;
    private final FailureCategory category;
    private final boolean hard;

    SubmissionOutcome(HttpStatus status, FailureCategory category, boolean hard) {
        this.status = status;
        this.category = category;
        this.hard = hard;
    }

    public HttpStatus status() {
        return status;
    }

    public FailureCategory category() {
        return category;
    }

    public boolean isHard() {
        return hard;
    }

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
