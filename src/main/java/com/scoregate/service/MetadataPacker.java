package com.scoregate.service;

import java.util.List;

import org.springframework.stereotype.Component;

import com.scoregate.model.AbilityStat;
import com.scoregate.model.Difficulty;
import com.scoregate.model.MetadataLayout;
import com.scoregate.model.Submission;
import com.scoregate.model.WeaponStat;

/**
 * Flattens a validated submission into the {@link MetadataLayout} int array
 * stored alongside the leaderboard score. Weapons and abilities are placed by
 * name, not by the order the client sent them; slots with no data stay zero.
 */
@Component
public class MetadataPacker {

    private static final int WEAPON_KILLS = 0;
    private static final int WEAPON_DAMAGE = 1;
    private static final int WEAPON_ACQUISITIONS = 2;

    private static final int ABILITY_USES = 0;
    private static final int ABILITY_UTILITY = 1;
    private static final int ABILITY_KILLS = 2;
    private static final int ABILITY_DAMAGE = 3;
    private static final int ABILITY_ACQUISITIONS = 4;

    public int[] pack(Submission submission) {
        int[] slots = new int[MetadataLayout.CAPACITY];

        for (WeaponStat weapon : submission.weaponStats()) {
            int index = MetadataLayout.WEAPON_ORDER.indexOf(weapon.name());
            if (index < 0) {
                continue;
            }
            slots[MetadataLayout.weaponSlot(index, WEAPON_KILLS)] = weapon.kills();
            slots[MetadataLayout.weaponSlot(index, WEAPON_DAMAGE)] = saturate(weapon.damage());
            slots[MetadataLayout.weaponSlot(index, WEAPON_ACQUISITIONS)] = weapon.acquisitionsOrZero();
        }

        for (AbilityStat ability : submission.abilityStats()) {
            int index = MetadataLayout.ABILITY_ORDER.indexOf(ability.name());
            if (index < 0) {
                continue;
            }
            slots[MetadataLayout.abilitySlot(index, ABILITY_USES)] = ability.uses();
            slots[MetadataLayout.abilitySlot(index, ABILITY_UTILITY)] = saturate(ability.utility());
            slots[MetadataLayout.abilitySlot(index, ABILITY_KILLS)] = ability.killsOrZero();
            slots[MetadataLayout.abilitySlot(index, ABILITY_DAMAGE)] = saturate(ability.damageOrZero());
            slots[MetadataLayout.abilitySlot(index, ABILITY_ACQUISITIONS)] = ability.acquisitionsOrZero();
        }

        slots[MetadataLayout.SUMMARY_VERSION] = MetadataLayout.VERSION;
        // 1-based so that zero keeps meaning "unset"
        slots[MetadataLayout.SUMMARY_DIFFICULTY] = Difficulty.fromTag(submission.difficulty())
                .map(difficulty -> difficulty.ordinal() + 1)
                .orElse(0);
        slots[MetadataLayout.SUMMARY_FINAL_SCORE] = saturate(submission.finalScore());
        slots[MetadataLayout.SUMMARY_TOTAL_KILLS] = saturate(submission.totalKills());
        slots[MetadataLayout.SUMMARY_TOTAL_WEAPON_DAMAGE] = saturate(submission.totalWeaponDamage());
        slots[MetadataLayout.SUMMARY_TOTAL_ABILITY_USES] = saturate(submission.totalAbilityUses());
        slots[MetadataLayout.SUMMARY_TOTAL_ABILITY_KILLS] = saturate(submission.totalAbilityKills());

        List<Long> roundTimes = submission.roundTimes();
        for (int i = 0; i < Math.min(roundTimes.size(), MetadataLayout.ROUND_SLOTS); i++) {
            slots[MetadataLayout.roundSlot(i)] = saturate(roundTimes.get(i));
        }
        return slots;
    }

    private static int saturate(long value) {
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, value));
    }
}
