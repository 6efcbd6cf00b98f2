package com.flagship.escrow_engine.event;

import com.flagship.escrow_engine.transaction.Actor;
import com.flagship.escrow_engine.transaction.EscrowTransaction;
import com.flagship.escrow_engine.transaction.TransactionStatus;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published on every committed status change of a sale, including its creation
 * ({@code fromStatus} null). Consumers deduplicate by (transactionId, toStatus).
 */
@Value
public class TransactionStatusChangedEvent implements EscrowEvent {
    UUID eventId;
    UUID transactionId;
    String fromStatus;
    String toStatus;
    UUID buyerId;
    UUID sellerId;
    String listingRef;
    long amount;
    String currency;
    UUID actorId;
    String actorRole;
    String reason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "transaction.status_changed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransactionStatusChangedEvent of(EscrowTransaction txn, TransactionStatus from,
                                                   Actor actor, String reason, Instant occurredAt) {
        return new TransactionStatusChangedEvent(
            UUID.randomUUID(),
            txn.getId(),
            from != null ? from.name() : null,
            txn.getStatus().name(),
            txn.getBuyerId(),
            txn.getSellerId(),
            txn.getListingRef(),
            txn.getAmount(),
            txn.getCurrency().name(),
            actor.getId(),
            actor.getRole().name(),
            reason,
            occurredAt
        );
    }
}
