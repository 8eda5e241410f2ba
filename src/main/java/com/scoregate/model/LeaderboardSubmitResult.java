package com.scoregate.model;

/**
 * Interpreted response of a leaderboard score upload. Ranks are 1-based, 0 when unranked.
 */
public record LeaderboardSubmitResult(
        boolean accepted,
        boolean scoreChanged,
        int previousRank,
        int newRank) {
}
