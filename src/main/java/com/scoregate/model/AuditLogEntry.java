package com.scoregate.model;

import java.time.Instant;

/**
 * One row of the request audit trail. Written by the pipeline, read only by
 * external analysis tooling. Nullable fields are unknown at the point of rejection.
 */
public record AuditLogEntry(
        Instant timestamp,
        String sourceAddress,
        String accountId,
        String difficulty,
        Long score,
        boolean rateLimited,
        boolean success,
        String outcome) {
}
