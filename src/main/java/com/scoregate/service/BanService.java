package com.scoregate.service;

import java.time.Clock;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import com.scoregate.client.LeaderboardGateway;
import com.scoregate.exception.BanNotFoundException;
import com.scoregate.exception.StoreUnavailableException;
import com.scoregate.model.BanRecord;
import com.scoregate.model.Difficulty;
import com.scoregate.repository.BanRepository;

/**
 * Sole writer of ban records. A new ban also removes the account from every
 * difficulty's leaderboard so its results stop showing to other players.
 */
@Service
public class BanService {
    private static final Logger logger = LoggerFactory.getLogger(BanService.class);

    private final BanRepository banRepository;
    private final LeaderboardGateway leaderboardGateway;
    private final Clock clock;

    @Autowired
    public BanService(BanRepository banRepository, LeaderboardGateway leaderboardGateway, Clock clock) {
        this.banRepository = banRepository;
        this.leaderboardGateway = leaderboardGateway;
        this.clock = clock;
    }

    /**
     * Fails open: a storage error is logged and reported as not banned, so a
     * database outage does not lock out every player.
     */
    public boolean isBanned(String accountId) {
        try {
            return banRepository.exists(accountId);
        } catch (DataAccessException e) {
            logger.error("Error checking ban status for {}", accountId, e);
            return false;
        }
    }

    /**
     * Bans an account. Idempotent: banning a banned account changes nothing.
     *
     * @return true if the account is banned after the call, false if the ban could not be stored
     */
    public boolean ban(String accountId, String sourceAddress, String reason) {
        boolean inserted;
        try {
            inserted = banRepository.insertIfAbsent(new BanRecord(accountId, sourceAddress, reason, clock.instant()));
        } catch (DataAccessException e) {
            logger.error("Failed to ban {} ({})", accountId, reason, e);
            return false;
        }
        if (!inserted) {
            logger.info("Account {} already banned", accountId);
            return true;
        }
        logger.warn("AUTO-BAN: account {} from {}: {}", accountId, sourceAddress, reason);
        removeFromLeaderboards(accountId);
        return true;
    }

    public BanRecord find(String accountId) {
        return lookup(accountId)
                .orElseThrow(() -> new BanNotFoundException("Account " + accountId + " is not banned"));
    }

    /**
     * Lifts a ban. Leaderboard entries removed by the ban are not restored.
     */
    public void unban(String accountId) {
        boolean deleted;
        try {
            deleted = banRepository.delete(accountId);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to unban " + accountId, e);
        }
        if (!deleted) {
            throw new BanNotFoundException("Account " + accountId + " is not banned");
        }
        logger.info("Ban lifted for account {}", accountId);
    }

    private Optional<BanRecord> lookup(String accountId) {
        try {
            return banRepository.findByAccountId(accountId);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to read ban of " + accountId, e);
        }
    }

    private void removeFromLeaderboards(String accountId) {
        for (Difficulty difficulty : Difficulty.values()) {
            try {
                leaderboardGateway.deleteEntry(difficulty, accountId);
            } catch (RuntimeException e) {
                logger.error("Failed to remove banned account {} from {} leaderboard: {}", accountId, difficulty,
                        e.getMessage());
            }
        }
    }
}
