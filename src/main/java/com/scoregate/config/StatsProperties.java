package com.scoregate.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.scoregate.model.MetadataLayout;
import com.scoregate.model.SpawnProfile;

/**
 * Gameplay bounds used by the stats validator.
 * The spawn profile table and the name lists are physics of the game; the ceilings
 * and floors are conservative balance estimates and are expected to be retuned.
 */
@ConfigurationProperties(prefix = "scoregate.stats")
public class StatsProperties {

    private int roundCount = 10;
    private long spawnDurationMs = 2300;
    private long maxRoundTimeMs = 1_800_000;
    private long finalScoreToleranceMs = 500;

    private List<String> weaponNames = new ArrayList<>(MetadataLayout.WEAPON_ORDER);
    private List<String> abilityNames = new ArrayList<>(MetadataLayout.ABILITY_ORDER);
    private List<String> derivedUtilityAbilities = new ArrayList<>(List.of("combustion"));

    private int maxWeaponKills = 300;
    private long maxWeaponDamage = 200_000;
    private long minTotalWeaponDamage = 5_000;
    private long maxTotalWeaponDamage = 500_000;

    private int maxAbilityUses = 500;
    private long maxAbilityUtility = 100_000;
    private int maxAbilityKills = 300;
    private long maxAbilityDamage = 200_000;
    private int maxTotalAbilityUses = 1_000;

    private int maxTotalKills = 300;

    private List<SpawnProfile> spawnProfiles = new ArrayList<>(List.of(
            new SpawnProfile(12, 0, 15),
            new SpawnProfile(15, 1, 16),
            new SpawnProfile(15, 1, 17),
            new SpawnProfile(18, 1, 18),
            new SpawnProfile(21, 2, 18),
            new SpawnProfile(25, 2, 19),
            new SpawnProfile(27, 2, 19),
            new SpawnProfile(30, 3, 20),
            new SpawnProfile(32, 3, 20),
            new SpawnProfile(36, 3, 21)));

    public int getRoundCount() {
        return roundCount;
    }

    public void setRoundCount(int roundCount) {
        this.roundCount = roundCount;
    }

    public long getSpawnDurationMs() {
        return spawnDurationMs;
    }

    public void setSpawnDurationMs(long spawnDurationMs) {
        this.spawnDurationMs = spawnDurationMs;
    }

    public long getMaxRoundTimeMs() {
        return maxRoundTimeMs;
    }

    public void setMaxRoundTimeMs(long maxRoundTimeMs) {
        this.maxRoundTimeMs = maxRoundTimeMs;
    }

    public long getFinalScoreToleranceMs() {
        return finalScoreToleranceMs;
    }

    public void setFinalScoreToleranceMs(long finalScoreToleranceMs) {
        this.finalScoreToleranceMs = finalScoreToleranceMs;
    }

    public List<String> getWeaponNames() {
        return weaponNames;
    }

    public void setWeaponNames(List<String> weaponNames) {
        this.weaponNames = weaponNames;
    }

    public List<String> getAbilityNames() {
        return abilityNames;
    }

    public void setAbilityNames(List<String> abilityNames) {
        this.abilityNames = abilityNames;
    }

    public List<String> getDerivedUtilityAbilities() {
        return derivedUtilityAbilities;
    }

    public void setDerivedUtilityAbilities(List<String> derivedUtilityAbilities) {
        this.derivedUtilityAbilities = derivedUtilityAbilities;
    }

    public int getMaxWeaponKills() {
        return maxWeaponKills;
    }

    public void setMaxWeaponKills(int maxWeaponKills) {
        this.maxWeaponKills = maxWeaponKills;
    }

    public long getMaxWeaponDamage() {
        return maxWeaponDamage;
    }

    public void setMaxWeaponDamage(long maxWeaponDamage) {
        this.maxWeaponDamage = maxWeaponDamage;
    }

    public long getMinTotalWeaponDamage() {
        return minTotalWeaponDamage;
    }

    public void setMinTotalWeaponDamage(long minTotalWeaponDamage) {
        this.minTotalWeaponDamage = minTotalWeaponDamage;
    }

    public long getMaxTotalWeaponDamage() {
        return maxTotalWeaponDamage;
    }

    public void setMaxTotalWeaponDamage(long maxTotalWeaponDamage) {
        this.maxTotalWeaponDamage = maxTotalWeaponDamage;
    }

    public int getMaxAbilityUses() {
        return maxAbilityUses;
    }

    public void setMaxAbilityUses(int maxAbilityUses) {
        this.maxAbilityUses = maxAbilityUses;
    }

    public long getMaxAbilityUtility() {
        return maxAbilityUtility;
    }

    public void setMaxAbilityUtility(long maxAbilityUtility) {
        this.maxAbilityUtility = maxAbilityUtility;
    }

    public int getMaxAbilityKills() {
        return maxAbilityKills;
    }

    public void setMaxAbilityKills(int maxAbilityKills) {
        this.maxAbilityKills = maxAbilityKills;
    }

    public long getMaxAbilityDamage() {
        return maxAbilityDamage;
    }

    public void setMaxAbilityDamage(long maxAbilityDamage) {
        this.maxAbilityDamage = maxAbilityDamage;
    }

    public int getMaxTotalAbilityUses() {
        return maxTotalAbilityUses;
    }

    public void setMaxTotalAbilityUses(int maxTotalAbilityUses) {
        this.maxTotalAbilityUses = maxTotalAbilityUses;
    }

    public int getMaxTotalKills() {
        return maxTotalKills;
    }

    public void setMaxTotalKills(int maxTotalKills) {
        this.maxTotalKills = maxTotalKills;
    }

    public List<SpawnProfile> getSpawnProfiles() {
        return spawnProfiles;
    }

    public void setSpawnProfiles(List<SpawnProfile> spawnProfiles) {
        this.spawnProfiles = spawnProfiles;
    }
}
