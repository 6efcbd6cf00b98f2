package com.flagship.escrow_engine.ledger;

public enum WalletKind {
    USER,
    PLATFORM_FEE
}
