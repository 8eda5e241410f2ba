package com.scoregate.dto;

public record WeaponStatRequest(
        String name,
        Integer kills,
        Long damage,
        Integer acquisitions) {
}
