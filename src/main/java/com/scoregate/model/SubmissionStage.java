package com.scoregate.model;

/**
 * Gates of the submission pipeline, in the order they run.
 */
public enum SubmissionStage {
    RATE_CHECK,
    STRUCTURAL_CHECK,
    IDENTITY_TICKET_CHECK,
    BAN_CHECK,
    FIELD_COMPLETENESS_CHECK,
    TOKEN_SIGNATURE_CHECK,
    TOKEN_OWNER_MATCH_CHECK,
    TOKEN_REPLAY_CHECK,
    STATS_CHECK,
    PACK_AND_FORWARD,
    LOG
}
