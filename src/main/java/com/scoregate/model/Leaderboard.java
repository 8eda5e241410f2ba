package com.scoregate.model;

import java.util.Map;
import java.util.NavigableSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;

/**
 * In-process leaderboard for one difficulty.
 * Contains the sorted set of best times and a map for quick account lookup.
 * Uploads use KeepBest semantics: a slower time never replaces a faster one.
 */
public class Leaderboard {

    // Sorted by score (asc) and then timestamp (asc)
    private final NavigableSet<LeaderboardEntry> sortedScores = new ConcurrentSkipListSet<>();

    // Maps accountId to their current best entry
    private final Map<String, LeaderboardEntry> accountScores = new ConcurrentHashMap<>();

    /**
     * Uploads a score, keeping the account's best.
     * Rank computation and replacement happen under one lock so the reported
     * previous/new ranks belong to the same update.
     */
    public synchronized LeaderboardSubmitResult submitKeepBest(LeaderboardEntry newEntry) {
        int previousRank = getRank(newEntry.accountId());
        LeaderboardEntry oldEntry = accountScores.get(newEntry.accountId());

        if (!newEntry.isBetterThan(oldEntry)) {
            return new LeaderboardSubmitResult(true, false, previousRank, previousRank);
        }
        if (oldEntry != null) {
            sortedScores.remove(oldEntry);
        }
        sortedScores.add(newEntry);
        accountScores.put(newEntry.accountId(), newEntry);

        return new LeaderboardSubmitResult(true, true, previousRank, getRank(newEntry.accountId()));
    }

    public synchronized boolean remove(String accountId) {
        LeaderboardEntry entry = accountScores.remove(accountId);
        if (entry == null) {
            return false;
        }
        sortedScores.remove(entry);
        return true;
    }

    public LeaderboardEntry getEntry(String accountId) {
        return accountScores.get(accountId);
    }

    /**
     * @return the 1-based rank of the account, or 0 when it has no entry.
     */
    public int getRank(String accountId) {
        LeaderboardEntry accountEntry = accountScores.get(accountId);
        if (accountEntry == null) {
            return 0;
        }
        return sortedScores.headSet(accountEntry).size() + 1;
    }

    public int getTotalPlayers() {
        return sortedScores.size();
    }
}
