package com.flagship.escrow_engine.error;

/**
 * Failure kinds the engine reports to its callers.
 *
 * Only {@link #STORE_UNAVAILABLE} is worth retrying; every other code is a
 * caller or business-rule violation and retrying the same request yields the same answer.
 */
public enum ErrorCode {
    INVALID_AMOUNT,
    SAME_PARTY,
    CURRENCY_MISMATCH,
    INSUFFICIENT_FUNDS,
    INVALID_STATE_TRANSITION,
    DUPLICATE_HOLD,
    HOLD_NOT_ACTIVE,
    ALREADY_DISPUTED,
    ALREADY_RESOLVED,
    FORBIDDEN,
    NOT_FOUND,
    IDEMPOTENCY_CONFLICT,
    DEADLINE_EXCEEDED,
    STORE_UNAVAILABLE;

    public boolean isRetryable() {
        return this == STORE_UNAVAILABLE;
    }
}
