package com.flagship.escrow_engine.ledger;

public enum WalletStatus {
    /** Accepts every operation. */
    ACTIVE,
    /** Rejects debits and new holds; still receives credits and released funds. */
    BLOCKED,
    /** Terminal. Only reachable with zero balances. */
    CLOSED
}
