package com.flagship.escrow_engine.ledger;

/**
 * Why a ledger entry was written.
 *
 * Only DEPOSIT and WITHDRAWAL change the total amount of money in the system;
 * the others move money between buckets or between wallets.
 */
public enum EntryReason {
    DEPOSIT,
    WITHDRAWAL,
    HOLD,
    CAPTURE,
    RELEASE,
    EXPIRE,
    FEE;

    public boolean isExternal() {
        return this == DEPOSIT || this == WITHDRAWAL;
    }
}
