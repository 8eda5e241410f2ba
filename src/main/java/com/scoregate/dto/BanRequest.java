package com.scoregate.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record BanRequest(
        @NotBlank(message = "Account ID is required.") String accountId,
        @NotBlank(message = "Reason is required.") @Size(max = 500, message = "Reason cannot exceed 500 characters.") String reason) {
}
