package com.flagship.escrow_engine.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of one balance change on one wallet.
 *
 * {@code amount} is the net change of the wallet total; the two deltas say how
 * it split between the available and held buckets. A hold, for example, is
 * {@code amount = 0, availableDelta = -x, heldDelta = +x}.
 *
 * Key invariant: for every wallet, the sums of the deltas equal the stored balances.
 */
@Value
public class LedgerEntry {
    UUID id;
    UUID walletId;
    long amount;
    long availableDelta;
    long heldDelta;
    CurrencyCode currency;
    EntryReason reason;
    String txnRef;
    String description;
    Instant createdAt;
    Long sequenceNumber;
}
