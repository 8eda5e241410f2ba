package com.scoregate.model;

/**
 * Outcome of one pass through the submission pipeline.
 * {@code reason} is the machine-readable rejection reason, null on success.
 */
public record SubmissionResult(
        SubmissionOutcome outcome,
        boolean accepted,
        boolean scoreChanged,
        int previousRank,
        int newRank,
        boolean banned,
        String reason,
        Long retryAfterSeconds) {

    public static SubmissionResult success(LeaderboardSubmitResult leaderboardResult) {
        return new SubmissionResult(SubmissionOutcome.SUCCESS, leaderboardResult.accepted(),
                leaderboardResult.scoreChanged(), leaderboardResult.previousRank(), leaderboardResult.newRank(),
                false, null, null);
    }

    public static SubmissionResult rejected(SubmissionOutcome outcome, boolean banned, String reason,
            Long retryAfterSeconds) {
        return new SubmissionResult(outcome, false, false, 0, 0, banned, reason, retryAfterSeconds);
    }
}
