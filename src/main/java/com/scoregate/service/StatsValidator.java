package com.scoregate.service;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.scoregate.config.StatsProperties;
import com.scoregate.model.AbilityStat;
import com.scoregate.model.Difficulty;
import com.scoregate.model.SpawnProfile;
import com.scoregate.model.StatsCheckResult;
import com.scoregate.model.StatsViolation;
import com.scoregate.model.Submission;
import com.scoregate.model.WeaponStat;

/**
 * Deterministic plausibility rules for a run's statistics.
 * Checks run in a fixed order and the first failure is reported. Round numbers in
 * reasons are 1-based.
 */
@Component
public class StatsValidator {

    private final StatsProperties properties;

    @Autowired
    public StatsValidator(StatsProperties properties) {
        if (properties.getSpawnProfiles().size() != properties.getRoundCount()) {
            throw new IllegalStateException("Spawn profile table has " + properties.getSpawnProfiles().size()
                    + " rounds, round count is " + properties.getRoundCount());
        }
        this.properties = properties;
    }

    public StatsCheckResult validate(Submission submission) {
        if (Difficulty.fromTag(submission.difficulty()).isEmpty()) {
            return StatsCheckResult.reject(StatsViolation.UNKNOWN_DIFFICULTY, "difficulty " + submission.difficulty());
        }

        int roundCount = properties.getRoundCount();
        if (submission.roundTimes().size() != roundCount || submission.roundKills().size() != roundCount) {
            return StatsCheckResult.reject(StatsViolation.ROUND_COUNT_MISMATCH,
                    String.format("%d round times, %d round kills, expected %d",
                            submission.roundTimes().size(), submission.roundKills().size(), roundCount));
        }

        StatsCheckResult result = checkRounds(submission);
        if (!result.valid()) {
            return result;
        }

        long roundTimeSum = 0;
        long difference;
        try {
            for (long roundTime : submission.roundTimes()) {
                roundTimeSum = Math.addExact(roundTimeSum, roundTime);
            }
            difference = Math.absExact(Math.subtractExact(submission.finalScore(), roundTimeSum));
        } catch (ArithmeticException e) {
            return StatsCheckResult.reject(StatsViolation.FINAL_SCORE_MISMATCH,
                    String.format("final score %d does not match round times", submission.finalScore()));
        }
        if (difference > properties.getFinalScoreToleranceMs()) {
            return StatsCheckResult.reject(StatsViolation.FINAL_SCORE_MISMATCH,
                    String.format("final score %d, round times sum to %d", submission.finalScore(), roundTimeSum));
        }

        result = checkWeapons(submission.weaponStats());
        if (!result.valid()) {
            return result;
        }

        result = checkAbilities(submission.abilityStats());
        if (!result.valid()) {
            return result;
        }

        return checkTotals(submission);
    }

    private StatsCheckResult checkRounds(Submission submission) {
        List<SpawnProfile> profiles = properties.getSpawnProfiles();
        for (int i = 0; i < properties.getRoundCount(); i++) {
            SpawnProfile profile = profiles.get(i);
            int round = i + 1;

            long roundTime = submission.roundTimes().get(i);
            long minimumTime = profile.minimumRoundTimeMs(properties.getSpawnDurationMs());
            if (roundTime < minimumTime) {
                return StatsCheckResult.reject(StatsViolation.ROUND_TIME_TOO_SHORT,
                        String.format("round %d: %dms is below %dms", round, roundTime, minimumTime));
            }
            if (roundTime > properties.getMaxRoundTimeMs()) {
                return StatsCheckResult.reject(StatsViolation.ROUND_TIME_TOO_LONG,
                        String.format("round %d: %dms exceeds %dms", round, roundTime, properties.getMaxRoundTimeMs()));
            }

            int kills = submission.roundKills().get(i);
            if (kills < profile.minimumKills() || kills > profile.expectedEnemyCount()) {
                return StatsCheckResult.reject(StatsViolation.ROUND_KILLS_OUT_OF_RANGE,
                        String.format("round %d: %d kills outside [%d, %d]", round, kills, profile.minimumKills(),
                                profile.expectedEnemyCount()));
            }
        }
        return StatsCheckResult.ok();
    }

    private StatsCheckResult checkWeapons(List<WeaponStat> weapons) {
        if (!matchesSlots(weapons, WeaponStat::name, properties.getWeaponNames())) {
            return StatsCheckResult.reject(StatsViolation.WEAPON_SLOT_MISMATCH,
                    weapons.size() + " weapon slots, expected " + properties.getWeaponNames());
        }

        long totalDamage = 0;
        for (WeaponStat weapon : weapons) {
            if (weapon.kills() < 0 || weapon.kills() > properties.getMaxWeaponKills()
                    || weapon.damage() < 0 || weapon.damage() > properties.getMaxWeaponDamage()
                    || weapon.acquisitionsOrZero() < 0) {
                return StatsCheckResult.reject(StatsViolation.WEAPON_STAT_OUT_OF_RANGE,
                        String.format("%s: %d kills, %d damage", weapon.name(), weapon.kills(), weapon.damage()));
            }
            totalDamage += weapon.damage();
        }

        if (totalDamage < properties.getMinTotalWeaponDamage() || totalDamage > properties.getMaxTotalWeaponDamage()) {
            return StatsCheckResult.reject(StatsViolation.WEAPON_DAMAGE_OUT_OF_RANGE,
                    String.format("total weapon damage %d outside [%d, %d]", totalDamage,
                            properties.getMinTotalWeaponDamage(), properties.getMaxTotalWeaponDamage()));
        }
        return StatsCheckResult.ok();
    }

    private StatsCheckResult checkAbilities(List<AbilityStat> abilities) {
        if (!matchesSlots(abilities, AbilityStat::name, properties.getAbilityNames())) {
            return StatsCheckResult.reject(StatsViolation.ABILITY_SLOT_MISMATCH,
                    abilities.size() + " ability slots, expected " + properties.getAbilityNames());
        }

        for (AbilityStat ability : abilities) {
            if (ability.uses() < 0 || ability.uses() > properties.getMaxAbilityUses()
                    || ability.utility() < 0 || ability.utility() > properties.getMaxAbilityUtility()
                    || ability.killsOrZero() < 0 || ability.killsOrZero() > properties.getMaxAbilityKills()
                    || ability.damageOrZero() < 0 || ability.damageOrZero() > properties.getMaxAbilityDamage()
                    || ability.acquisitionsOrZero() < 0) {
                return StatsCheckResult.reject(StatsViolation.ABILITY_STAT_OUT_OF_RANGE,
                        String.format("%s: %d uses, %d utility, %d kills", ability.name(), ability.uses(),
                                ability.utility(), ability.killsOrZero()));
            }
            if (properties.getDerivedUtilityAbilities().contains(ability.name())
                    && ability.utility() != ability.killsOrZero()) {
                return StatsCheckResult.reject(StatsViolation.DERIVED_UTILITY_MISMATCH,
                        String.format("%s: utility %d must equal kills %d", ability.name(), ability.utility(),
                                ability.killsOrZero()));
            }
        }
        return StatsCheckResult.ok();
    }

    private StatsCheckResult checkTotals(Submission submission) {
        long totalUses = submission.totalAbilityUses();
        if (totalUses > properties.getMaxTotalAbilityUses()) {
            return StatsCheckResult.reject(StatsViolation.ABILITY_USES_OUT_OF_RANGE,
                    String.format("total ability uses %d exceed %d", totalUses, properties.getMaxTotalAbilityUses()));
        }

        long totalKills = submission.totalKills();
        if (totalKills > properties.getMaxTotalKills()) {
            return StatsCheckResult.reject(StatsViolation.TOTAL_KILLS_OUT_OF_RANGE,
                    String.format("total kills %d exceed %d", totalKills, properties.getMaxTotalKills()));
        }

        long roundKillSum = submission.roundKills().stream().mapToLong(Integer::longValue).sum();
        if (totalKills != roundKillSum) {
            return StatsCheckResult.reject(StatsViolation.KILL_COUNT_INCONSISTENT,
                    String.format("weapon and ability kills %d, round kills %d", totalKills, roundKillSum));
        }
        return StatsCheckResult.ok();
    }

    /**
     * True when every configured name appears exactly once and nothing else does.
     */
    private static <T> boolean matchesSlots(List<T> stats, Function<T, String> name, List<String> expectedNames) {
        if (stats.size() != expectedNames.size()) {
            return false;
        }
        Set<String> seen = new HashSet<>();
        for (T stat : stats) {
            String statName = name.apply(stat);
            if (!expectedNames.contains(statName) || !seen.add(statName)) {
                return false;
            }
        }
        return true;
    }
}
