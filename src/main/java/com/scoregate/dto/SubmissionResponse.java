package com.scoregate.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Structured result of a submission. {@code reason} and {@code retryAfterSeconds}
 * are only filled in when detailed responses are enabled.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubmissionResponse(
        boolean accepted,
        boolean scoreChanged,
        int previousRank,
        int newRank,
        boolean banned,
        String reason,
        Long retryAfterSeconds) {
}
