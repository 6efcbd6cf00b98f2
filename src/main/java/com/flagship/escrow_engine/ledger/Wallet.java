package com.flagship.escrow_engine.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Read model of a wallet row.
 *
 * Balances are a materialized cache over the ledger entries for the wallet.
 * Instances are snapshots; all mutation goes through {@link LedgerStore}.
 */
@Value
public class Wallet {
    UUID id;
    UUID ownerId;
    CurrencyCode currency;
    WalletKind kind;
    long availableBalance;
    long heldBalance;
    WalletStatus status;
    long version;
    Instant createdAt;
    Instant updatedAt;

    public long getTotalBalance() {
        return availableBalance + heldBalance;
    }

    public boolean canBeDebited() {
        return status == WalletStatus.ACTIVE;
    }

    public boolean canBeCredited() {
        return status != WalletStatus.CLOSED;
    }
}
