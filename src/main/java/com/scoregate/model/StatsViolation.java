package com.scoregate.model;

/**
 * Reasons the stats validator can reject a submission. Listed in check order.
 */
public enum StatsViolation {
    UNKNOWN_DIFFICULTY,
    ROUND_COUNT_MISMATCH,
    ROUND_TIME_TOO_SHORT,
    ROUND_TIME_TOO_LONG,
    ROUND_KILLS_OUT_OF_RANGE,
    FINAL_SCORE_MISMATCH,
    WEAPON_SLOT_MISMATCH,
    WEAPON_STAT_OUT_OF_RANGE,
    WEAPON_DAMAGE_OUT_OF_RANGE,
    ABILITY_SLOT_MISMATCH,
    ABILITY_STAT_OUT_OF_RANGE,
    DERIVED_UTILITY_MISMATCH,
    ABILITY_USES_OUT_OF_RANGE,
    TOTAL_KILLS_OUT_OF_RANGE,
    KILL_COUNT_INCONSISTENT
}
