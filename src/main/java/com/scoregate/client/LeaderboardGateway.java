package com.scoregate.client;

import com.scoregate.model.Difficulty;
import com.scoregate.model.LeaderboardSubmitResult;

/**
 * The external leaderboard. One leaderboard per difficulty; scores are elapsed
 * times and uploads keep the account's best.
 */
public interface LeaderboardGateway {

    /**
     * @param metadata packed statistics, or null to upload the score alone
     * @throws com.scoregate.exception.LeaderboardServiceException when the upload fails
     */
    LeaderboardSubmitResult submitScore(Difficulty difficulty, String accountId, long score, int[] metadata);

    /**
     * @throws com.scoregate.exception.LeaderboardServiceException when the deletion fails
     */
    void deleteEntry(Difficulty difficulty, String accountId);
}
