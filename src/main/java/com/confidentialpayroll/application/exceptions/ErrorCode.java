package com.confidentialpayroll.application.exceptions;

/**
 * Named failure causes exposed to callers so that external tooling can branch on them.
 */
public enum ErrorCode {
    NOT_ADMIN,
    NOT_PROVIDER,
    NOT_ORACLE,
    PAUSED,
    COOLDOWN_ACTIVE,
    INVALID_BATCH,
    INVALID_BATCH_STATE,
    UNKNOWN_REQUEST,
    DUPLICATE_CONTRIBUTION,
    INVALID_CIPHERTEXT,
    REPLAY_ATTEMPT,
    STATE_MISMATCH,
    PROOF_VERIFICATION_FAILED,
    MALFORMED_CLEARTEXTS
}
