package com.scoregate.model;

/**
 * Ground truth for one round: how many enemies spawn, how many of them die on
 * their own without being killed by the player, and when the last spawn is triggered.
 */
public record SpawnProfile(
        int expectedEnemyCount,
        int selfResolvingCount,
        int lastSpawnTriggerSeconds) {

    public int minimumKills() {
        return expectedEnemyCount - selfResolvingCount;
    }

    public long minimumRoundTimeMs(long spawnDurationMs) {
        return lastSpawnTriggerSeconds * 1000L + spawnDurationMs;
    }
}
