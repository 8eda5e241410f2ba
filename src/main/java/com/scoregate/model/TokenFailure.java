package com.scoregate.model;

public enum TokenFailure {
    MALFORMED(SubmissionOutcome.MALFORMED_TOKEN),
    BAD_SIGNATURE(SubmissionOutcome.BAD_TOKEN_SIGNATURE),
    EXPIRED(SubmissionOutcome.TOKEN_EXPIRED);

    private final SubmissionOutcome outcome;

    TokenFailure(SubmissionOutcome outcome) {
        this.outcome = outcome;
    }

    public SubmissionOutcome outcome() {
        return outcome;
    }
}
