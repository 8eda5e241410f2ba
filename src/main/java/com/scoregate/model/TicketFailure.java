package com.scoregate.model;

/**
 * Ways an identity ticket can fail validation.
 * Only {@link #VALIDATION_FAILED} is inconclusive and maps to a transient outcome.
 */
public enum TicketFailure {
    INVALID_TICKET(SubmissionOutcome.INVALID_TICKET),
    IDENTITY_MISMATCH(SubmissionOutcome.IDENTITY_MISMATCH),
    NOT_ENTITLED(SubmissionOutcome.NOT_ENTITLED),
    VALIDATION_FAILED(SubmissionOutcome.TICKET_VALIDATION_FAILED);

    private final SubmissionOutcome outcome;

    TicketFailure(SubmissionOutcome outcome) {
        this.outcome = outcome;
    }

    public SubmissionOutcome outcome() {
        return outcome;
    }
}
