package com.scoregate.client;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.scoregate.exception.LeaderboardServiceException;
import com.scoregate.model.Difficulty;
import com.scoregate.model.Leaderboard;
import com.scoregate.model.LeaderboardEntry;
import com.scoregate.model.LeaderboardSubmitResult;
import com.scoregate.model.MetadataLayout;

/**
 * In-process stand-in for the external leaderboard, used for local runs and tests.
 * Keeps one {@link Leaderboard} per difficulty and holds the last metadata blob of
 * each account in memory only.
 */
@Component
@ConditionalOnProperty(name = "scoregate.leaderboard.mode", havingValue = "local", matchIfMissing = true)
public class LocalLeaderboardGateway implements LeaderboardGateway {
    private static final Logger logger = LoggerFactory.getLogger(LocalLeaderboardGateway.class);

    private final Map<Difficulty, Leaderboard> leaderboards = new EnumMap<>(Difficulty.class);
    private final Map<Difficulty, Map<String, int[]>> metadataByDifficulty = new EnumMap<>(Difficulty.class);
    private final Clock clock;

    @Autowired
    public LocalLeaderboardGateway(Clock clock) {
        this.clock = clock;
        for (Difficulty difficulty : Difficulty.values()) {
            leaderboards.put(difficulty, new Leaderboard());
            metadataByDifficulty.put(difficulty, new ConcurrentHashMap<>());
        }
    }

    @Override
    public LeaderboardSubmitResult submitScore(Difficulty difficulty, String accountId, long score, int[] metadata) {
        if (metadata != null && metadata.length > MetadataLayout.CAPACITY) {
            throw LeaderboardServiceException.payloadRejected(
                    "Metadata has " + metadata.length + " slots, capacity is " + MetadataLayout.CAPACITY);
        }
        LeaderboardSubmitResult result = leaderboards.get(difficulty)
                .submitKeepBest(new LeaderboardEntry(accountId, score, clock.millis()));
        if (result.scoreChanged() && metadata != null) {
            metadataByDifficulty.get(difficulty).put(accountId, metadata.clone());
        }
        logger.debug("Local leaderboard {}: account {} score {} rank {} -> {}", difficulty, accountId, score,
                result.previousRank(), result.newRank());
        return result;
    }

    @Override
    public void deleteEntry(Difficulty difficulty, String accountId) {
        leaderboards.get(difficulty).remove(accountId);
        metadataByDifficulty.get(difficulty).remove(accountId);
    }

    public Leaderboard getLeaderboard(Difficulty difficulty) {
        return leaderboards.get(difficulty);
    }

    public int[] getMetadata(Difficulty difficulty, String accountId) {
        return metadataByDifficulty.get(difficulty).get(accountId);
    }
}
