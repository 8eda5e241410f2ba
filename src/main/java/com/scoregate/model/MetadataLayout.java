package com.scoregate.model;

import java.util.List;

/**
 * Slot layout of the 64-int metadata blob stored next to each leaderboard score.
 * The downstream leaderboard consumer reads slots by offset, so any change to the
 * ordering or offsets below needs a new {@link #VERSION}.
 */
public final class MetadataLayout {

    public static final int VERSION = 1;
    public static final int CAPACITY = 64;

    public static final List<String> WEAPON_ORDER = List.of("pistol", "shotgun", "rifle", "launcher", "minigun");
    public static final List<String> ABILITY_ORDER = List.of("blast", "blade", "barrier", "combustion", "jump", "warp");

    // kills, damage, acquisitions
    public static final int FIELDS_PER_WEAPON = 3;
    // uses, utility, kills, damage, acquisitions
    public static final int FIELDS_PER_ABILITY = 5;

    public static final int WEAPON_OFFSET = 0;
    public static final int ABILITY_OFFSET = WEAPON_OFFSET + WEAPON_ORDER.size() * FIELDS_PER_WEAPON;
    public static final int SUMMARY_OFFSET = ABILITY_OFFSET + ABILITY_ORDER.size() * FIELDS_PER_ABILITY;
    public static final int SUMMARY_SLOTS = 9;
    public static final int ROUND_OFFSET = SUMMARY_OFFSET + SUMMARY_SLOTS;
    public static final int ROUND_SLOTS = 10;

    public static final int SUMMARY_VERSION = SUMMARY_OFFSET;
    public static final int SUMMARY_DIFFICULTY = SUMMARY_OFFSET + 1;
    public static final int SUMMARY_FINAL_SCORE = SUMMARY_OFFSET + 2;
    public static final int SUMMARY_TOTAL_KILLS = SUMMARY_OFFSET + 3;
    public static final int SUMMARY_TOTAL_WEAPON_DAMAGE = SUMMARY_OFFSET + 4;
    public static final int SUMMARY_TOTAL_ABILITY_USES = SUMMARY_OFFSET + 5;
    public static final int SUMMARY_TOTAL_ABILITY_KILLS = SUMMARY_OFFSET + 6;
    // SUMMARY_OFFSET + 7 and + 8 are reserved

    static {
        if (ROUND_OFFSET + ROUND_SLOTS != CAPACITY) {
            throw new IllegalStateException("Metadata layout does not fill " + CAPACITY + " slots");
        }
    }

    private MetadataLayout() {
    }

    public static int weaponSlot(int weaponIndex, int field) {
        return WEAPON_OFFSET + weaponIndex * FIELDS_PER_WEAPON + field;
    }

    public static int abilitySlot(int abilityIndex, int field) {
        return ABILITY_OFFSET + abilityIndex * FIELDS_PER_ABILITY + field;
    }

    public static int roundSlot(int roundIndex) {
        return ROUND_OFFSET + roundIndex;
    }
}
