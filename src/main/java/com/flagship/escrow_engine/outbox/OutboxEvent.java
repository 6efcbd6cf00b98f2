package com.flagship.escrow_engine.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An event waiting in (or already relayed from) the outbox table.
 *
 * Written in the same database transaction as the state change it describes,
 * relayed to Kafka afterwards by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Transaction" or "Dispute"
    UUID aggregateId;          // always the transaction id, so one sale keeps one partition
    String eventType;          // e.g. "transaction.status_changed"
    String payload;            // JSON
    String correlationId;
    Instant createdAt;
    Instant publishedAt;       // null until relayed
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId, String eventType,
                                     String payload, String correlationId, Instant now) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            correlationId,
            now,
            null,
            0,
            null,
            null   // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
