package com.scoregate.dto;

public record AbilityStatRequest(
        String name,
        Integer uses,
        Long utility,
        Integer kills,
        Long damage,
        Integer acquisitions) {
}
