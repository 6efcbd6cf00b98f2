package com.flagship.escrow_engine.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * Stored wallet balances side by side with the balances re-derived from the entry log.
 */
@Value
public class WalletReconciliation {
    UUID walletId;
    long storedAvailable;
    long storedHeld;
    long derivedAvailable;
    long derivedHeld;
    long entryCount;

    public boolean isBalanced() {
        return storedAvailable == derivedAvailable && storedHeld == derivedHeld;
    }
}
