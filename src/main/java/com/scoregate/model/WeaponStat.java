package com.scoregate.model;

/**
 * Per-weapon statistics for one run. {@code acquisitions} is optional and may be null.
 */
public record WeaponStat(
        String name,
        int kills,
        long damage,
        Integer acquisitions) {

    public int acquisitionsOrZero() {
        return acquisitions == null ? 0 : acquisitions;
    }
}
