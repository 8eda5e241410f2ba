package com.scoregate.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * Body of a score submission as sent by the game client.
 * Nothing is bean-validated here: a missing field is itself a pipeline signal
 * (a modified client) and is classified by the orchestrator, not rejected by Spring.
 */
public record ScoreSubmissionRequest(
        @JsonAlias("steamId") String accountId,
        String ticket,
        String difficulty,
        Long finalScore,
        List<Long> roundTimes,
        List<Integer> roundKills,
        @JsonAlias("gunStats") List<WeaponStatRequest> weaponStats,
        List<AbilityStatRequest> abilityStats,
        String token) {
}
