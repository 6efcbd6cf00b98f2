package com.flagship.escrow_engine.idempotency;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * What a completed keyed call produced, so a retry can be answered without re-executing it.
 *
 * {@code fingerprint} captures the call's arguments; the same key with another
 * operation or other arguments is a conflict, not a replay.
 */
@Value
public class IdempotencyRecord {
    String key;
    String operation;
    String fingerprint;
    UUID transactionId;
    UUID holdId;
    UUID disputeId;
    Instant createdAt;
    Instant expiresAt;

    public boolean matches(String operation, String fingerprint) {
        return this.operation.equals(operation) && this.fingerprint.equals(fingerprint);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
