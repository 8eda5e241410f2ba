package com.scoregate.exception;

import com.scoregate.model.SubmissionOutcome;
import com.scoregate.model.SubmissionStage;

/**
 * Thrown by a pipeline gate to short-circuit the request with a specific classification.
 * Caught by the orchestrator, which applies the ban policy and writes the audit entry.
 */
public class SubmissionRejectedException extends RuntimeException {
    private final SubmissionOutcome outcome;
    private final SubmissionStage stage;
    private final Long retryAfterSeconds;

    public SubmissionRejectedException(SubmissionOutcome outcome, SubmissionStage stage, String message) {
        this(outcome, stage, message, null, null);
    }

    public SubmissionRejectedException(SubmissionOutcome outcome, SubmissionStage stage, String message,
            Throwable cause) {
        this(outcome, stage, message, null, cause);
    }

    public SubmissionRejectedException(SubmissionOutcome outcome, SubmissionStage stage, String message,
            Long retryAfterSeconds, Throwable cause) {
        super(message, cause);
        this.outcome = outcome;
        this.stage = stage;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public static SubmissionRejectedException rateLimited(SubmissionStage stage, long retryAfterSeconds) {
        return new SubmissionRejectedException(SubmissionOutcome.RATE_LIMITED, stage,
                "Rate limit exceeded, retry after " + retryAfterSeconds + "s", retryAfterSeconds, null);
    }

    public SubmissionOutcome getOutcome() {
        return outcome;
    }

    public SubmissionStage getStage() {
        return stage;
    }

    public Long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
