package com.scoregate.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LeaderboardTest {

    private Leaderboard leaderboard;

    @BeforeEach
    void setUp() {
        leaderboard = new Leaderboard();
    }

    @Test
    void firstUploadCreatesEntry() {
        LeaderboardSubmitResult result = leaderboard.submitKeepBest(new LeaderboardEntry("a", 250_000, 1));

        assertThat(result.scoreChanged()).isTrue();
        assertThat(result.previousRank()).isZero();
        assertThat(result.newRank()).isEqualTo(1);
    }

    @Test
    void fasterTimeReplacesSlowerOne() {
        leaderboard.submitKeepBest(new LeaderboardEntry("a", 250_000, 1));
        leaderboard.submitKeepBest(new LeaderboardEntry("b", 240_000, 2));

        LeaderboardSubmitResult result = leaderboard.submitKeepBest(new LeaderboardEntry("a", 230_000, 3));

        assertThat(result.scoreChanged()).isTrue();
        assertThat(result.previousRank()).isEqualTo(2);
        assertThat(result.newRank()).isEqualTo(1);
        assertThat(leaderboard.getEntry("a").score()).isEqualTo(230_000);
        assertThat(leaderboard.getTotalPlayers()).isEqualTo(2);
    }

    @Test
    void slowerTimeKeepsBest() {
        leaderboard.submitKeepBest(new LeaderboardEntry("a", 230_000, 1));

        LeaderboardSubmitResult result = leaderboard.submitKeepBest(new LeaderboardEntry("a", 260_000, 2));

        assertThat(result.accepted()).isTrue();
        assertThat(result.scoreChanged()).isFalse();
        assertThat(result.newRank()).isEqualTo(1);
        assertThat(leaderboard.getEntry("a").score()).isEqualTo(230_000);
    }

    @Test
    void equalTimesRankEarlierSubmissionFirst() {
        leaderboard.submitKeepBest(new LeaderboardEntry("late", 240_000, 20));
        leaderboard.submitKeepBest(new LeaderboardEntry("early", 240_000, 10));

        assertThat(leaderboard.getRank("early")).isEqualTo(1);
        assertThat(leaderboard.getRank("late")).isEqualTo(2);
    }

    @Test
    void removeDropsEntryAndRanks() {
        leaderboard.submitKeepBest(new LeaderboardEntry("a", 230_000, 1));
        leaderboard.submitKeepBest(new LeaderboardEntry("b", 240_000, 2));

        assertThat(leaderboard.remove("a")).isTrue();
        assertThat(leaderboard.remove("a")).isFalse();
        assertThat(leaderboard.getRank("a")).isZero();
        assertThat(leaderboard.getRank("b")).isEqualTo(1);
    }
}
