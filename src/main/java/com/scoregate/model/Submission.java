package com.scoregate.model;

import java.util.List;

/**
 * One gameplay attempt as claimed by the client, after required-field checks.
 * All times are in milliseconds. The difficulty is kept as the raw tag so the
 * stats validator can classify an unknown tier.
 */
public record Submission(
        String accountId,
        String ticket,
        String difficulty,
        long finalScore,
        List<Long> roundTimes,
        List<Integer> roundKills,
        List<WeaponStat> weaponStats,
        List<AbilityStat> abilityStats,
        String token) {

    public Submission {
        roundTimes = List.copyOf(roundTimes);
        roundKills = List.copyOf(roundKills);
        weaponStats = List.copyOf(weaponStats);
        abilityStats = List.copyOf(abilityStats);
    }

    public long totalWeaponKills() {
        return weaponStats.stream().mapToLong(WeaponStat::kills).sum();
    }

    public long totalAbilityKills() {
        return abilityStats.stream().mapToLong(AbilityStat::killsOrZero).sum();
    }

    public long totalKills() {
        return totalWeaponKills() + totalAbilityKills();
    }

    public long totalWeaponDamage() {
        return weaponStats.stream().mapToLong(WeaponStat::damage).sum();
    }

    public long totalAbilityUses() {
        return abilityStats.stream().mapToLong(AbilityStat::uses).sum();
    }
}
