package com.scoregate.model;

public record TokenIssueResult(
        SubmissionOutcome outcome,
        IssuedToken issuedToken,
        long expiresInSeconds,
        String reason,
        Long retryAfterSeconds) {

    public static TokenIssueResult issued(IssuedToken issuedToken, long expiresInSeconds) {
        return new TokenIssueResult(SubmissionOutcome.SUCCESS, issuedToken, expiresInSeconds, null, null);
    }

    public static TokenIssueResult rejected(SubmissionOutcome outcome, String reason, Long retryAfterSeconds) {
        return new TokenIssueResult(outcome, null, 0, reason, retryAfterSeconds);
    }
}
