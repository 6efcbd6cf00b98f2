package com.flagship.escrow_engine.hold;

/**
 * Hold lifecycle. ACTIVE is the only non-terminal status; a hold is resolved exactly once.
 */
public enum HoldStatus {
    ACTIVE,
    /** Fully paid out to the payee (and the fee wallet). */
    CAPTURED,
    /** Fully returned to the payer by a decision. */
    RELEASED,
    /** Fully returned to the payer by a timeout. */
    EXPIRED,
    /** Partly returned to the payer, the remainder paid out. */
    SPLIT;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
