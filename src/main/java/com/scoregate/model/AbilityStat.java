package com.scoregate.model;

/**
 * Per-ability statistics for one run.
 * The meaning of {@code utility} depends on the ability (nanite spent, healing done,
 * damage absorbed, or a derived count). Kills, damage and acquisitions are optional.
 */
public record AbilityStat(
        String name,
        int uses,
        long utility,
        Integer kills,
        Long damage,
        Integer acquisitions) {

    public int killsOrZero() {
        return kills == null ? 0 : kills;
    }

    public long damageOrZero() {
        return damage == null ? 0L : damage;
    }

    public int acquisitionsOrZero() {
        return acquisitions == null ? 0 : acquisitions;
    }
}
