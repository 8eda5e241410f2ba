package com.scoregate.model;

import java.io.Serializable;

/**
 * A single account's best time on a leaderboard.
 * Implements Comparable for sorting (fastest time first, then earliest
 * timestamp).
 */
public record LeaderboardEntry(
        String accountId,
        long score,
        long timestamp) implements Comparable<LeaderboardEntry>, Serializable {

    /**
     * Primary sort: by score ascending (scores are elapsed times, lower is better).
     * Secondary sort: by timestamp ascending (earlier submission wins ties).
     * Account id breaks any remaining tie so distinct accounts never collide in a sorted set.
     */
    @Override
    public int compareTo(LeaderboardEntry other) {
        int scoreCompare = Long.compare(this.score, other.score);
        if (scoreCompare != 0) {
            return scoreCompare;
        }
        int timeCompare = Long.compare(this.timestamp, other.timestamp);
        if (timeCompare != 0) {
            return timeCompare;
        }
        return this.accountId.compareTo(other.accountId);
    }

    public boolean isBetterThan(LeaderboardEntry other) {
        return other == null || this.score < other.score;
    }
}
