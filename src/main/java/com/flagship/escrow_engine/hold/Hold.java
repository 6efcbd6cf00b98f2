package com.flagship.escrow_engine.hold;

import com.flagship.escrow_engine.ledger.CurrencyCode;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Funds carved out of a wallet's available balance and earmarked for one transaction.
 *
 * {@code amount} never changes; {@code releasedAmount} and {@code capturedAmount}
 * grow as the hold is resolved. While ACTIVE, the still-held part is {@link #getRemaining()}.
 */
@Value
public class Hold {
    UUID id;
    UUID walletId;
    UUID transactionId;
    long amount;
    long releasedAmount;
    long capturedAmount;
    CurrencyCode currency;
    HoldStatus status;
    Instant createdAt;
    Instant expiresAt;
    Instant resolvedAt;

    public long getRemaining() {
        return amount - releasedAmount - capturedAmount;
    }

    public boolean isActive() {
        return status == HoldStatus.ACTIVE;
    }
}
