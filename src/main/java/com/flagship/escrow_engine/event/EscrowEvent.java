package com.flagship.escrow_engine.event;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for lifecycle events emitted to external collaborators.
 *
 * Every event is keyed by the transaction it concerns, so a consumer sees one
 * sale's events in commit order.
 */
public interface EscrowEvent {

    /**
     * Unique per event instance; consumers may use it for deduplication.
     */
    UUID getEventId();

    UUID getTransactionId();

    Instant getOccurredAt();

    /**
     * Event type name for routing and filtering, e.g. {@code transaction.status_changed}.
     */
    String getEventType();

    /**
     * Outbox aggregate the event is filed under; decides the topic.
     */
    @JsonIgnore
    default String getAggregateType() {
        return "Transaction";
    }
}
