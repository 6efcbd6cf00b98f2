package com.flagship.escrow_engine.transaction;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One line of a sale's audit trail. {@code fromStatus} is null for the creation line.
 */
@Value
public class TransactionHistoryEvent {
    Long id;
    UUID transactionId;
    TransactionStatus fromStatus;
    TransactionStatus toStatus;
    UUID actorId;
    ActorRole actorRole;
    String reason;
    Instant occurredAt;
}
