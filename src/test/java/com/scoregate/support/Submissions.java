package com.scoregate.support;

import java.util.ArrayList;
import java.util.List;

import com.scoregate.dto.AbilityStatRequest;
import com.scoregate.dto.ScoreSubmissionRequest;
import com.scoregate.dto.WeaponStatRequest;
import com.scoregate.model.AbilityStat;
import com.scoregate.model.Submission;
import com.scoregate.model.WeaponStat;

/**
 * A plausible hard-difficulty run used across tests. Round kills equal the spawn
 * counts and weapon plus ability kills add up to the same 231.
 */
public final class Submissions {

    public static final List<Long> ROUND_TIMES = List.of(25000L, 26000L, 24500L, 32000L, 25500L, 26500L, 25000L,
            26000L, 25500L, 25000L);
    public static final long FINAL_SCORE = 261000L;
    public static final List<Integer> ROUND_KILLS = List.of(12, 15, 15, 18, 21, 25, 27, 30, 32, 36);

    private Submissions() {
    }

    public static List<WeaponStat> weapons() {
        return List.of(
                new WeaponStat("pistol", 40, 4000, 1),
                new WeaponStat("shotgun", 35, 6000, 1),
                new WeaponStat("rifle", 60, 9000, 1),
                new WeaponStat("launcher", 30, 12000, 1),
                new WeaponStat("minigun", 31, 8000, 1));
    }

    public static List<AbilityStat> abilities() {
        return List.of(
                new AbilityStat("blast", 12, 300, 10, 2500L, null),
                new AbilityStat("blade", 8, 200, 5, 1200L, null),
                new AbilityStat("barrier", 4, 900, null, null, null),
                new AbilityStat("combustion", 6, 20, 20, 3000L, null),
                new AbilityStat("jump", 15, 0, null, null, null),
                new AbilityStat("warp", 3, 0, null, null, null));
    }

    public static Submission valid(String accountId, String token) {
        return new Submission(accountId, "ticket", "hard", FINAL_SCORE, ROUND_TIMES, ROUND_KILLS, weapons(),
                abilities(), token);
    }

    public static Submission withRoundTimes(Submission base, List<Long> roundTimes) {
        long sum = roundTimes.stream().mapToLong(Long::longValue).sum();
        return new Submission(base.accountId(), base.ticket(), base.difficulty(), sum, roundTimes, base.roundKills(),
                base.weaponStats(), base.abilityStats(), base.token());
    }

    public static List<Long> roundTimesWith(int roundIndex, long time) {
        List<Long> times = new ArrayList<>(ROUND_TIMES);
        times.set(roundIndex, time);
        return times;
    }

    public static ScoreSubmissionRequest request(String accountId, String token) {
        Submission submission = valid(accountId, token);
        return new ScoreSubmissionRequest(accountId, "ticket", submission.difficulty(), submission.finalScore(),
                submission.roundTimes(), submission.roundKills(),
                submission.weaponStats().stream()
                        .map(w -> new WeaponStatRequest(w.name(), w.kills(), w.damage(), w.acquisitions()))
                        .toList(),
                submission.abilityStats().stream()
                        .map(a -> new AbilityStatRequest(a.name(), a.uses(), a.utility(), a.kills(), a.damage(),
                                a.acquisitions()))
                        .toList(),
                token);
    }
}
