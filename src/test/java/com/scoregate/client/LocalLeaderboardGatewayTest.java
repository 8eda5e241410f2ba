package com.scoregate.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;

import org.junit.jupiter.api.Test;

import com.scoregate.exception.LeaderboardServiceException;
import com.scoregate.model.Difficulty;
import com.scoregate.support.MutableClock;

class LocalLeaderboardGatewayTest {

    private final LocalLeaderboardGateway gateway =
            new LocalLeaderboardGateway(new MutableClock(Instant.parse("2026-01-01T00:00:00Z")));

    @Test
    void keepsMetadataOfBestRun() {
        gateway.submitScore(Difficulty.EASY, "acct", 250_000L, new int[] { 1, 2 });
        gateway.submitScore(Difficulty.EASY, "acct", 260_000L, new int[] { 9, 9 });

        assertThat(gateway.getMetadata(Difficulty.EASY, "acct")).containsExactly(1, 2);
        assertThat(gateway.getLeaderboard(Difficulty.EASY).getEntry("acct").score()).isEqualTo(250_000L);
    }

    @Test
    void difficultiesAreSeparateLeaderboards() {
        gateway.submitScore(Difficulty.EASY, "acct", 250_000L, null);

        assertThat(gateway.getLeaderboard(Difficulty.HARD).getRank("acct")).isZero();
    }

    @Test
    void oversizedMetadataIsRejectedAsPayload() {
        assertThatThrownBy(() -> gateway.submitScore(Difficulty.EASY, "acct", 1L, new int[65]))
                .isInstanceOfSatisfying(LeaderboardServiceException.class,
                        e -> assertThat(e.isPayloadRejected()).isTrue());
    }

    @Test
    void deleteRemovesEntryAndMetadata() {
        gateway.submitScore(Difficulty.EASY, "acct", 250_000L, new int[] { 1 });

        gateway.deleteEntry(Difficulty.EASY, "acct");

        assertThat(gateway.getLeaderboard(Difficulty.EASY).getTotalPlayers()).isZero();
        assertThat(gateway.getMetadata(Difficulty.EASY, "acct")).isNull();
    }
}
