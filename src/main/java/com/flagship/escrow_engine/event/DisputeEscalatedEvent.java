package com.flagship.escrow_engine.event;

import com.flagship.escrow_engine.dispute.Dispute;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published once per dispute when it outlives its SLA, for the moderation queue.
 * The engine never resolves a dispute on its own.
 */
@Value
public class DisputeEscalatedEvent implements EscrowEvent {
    UUID eventId;
    UUID transactionId;
    UUID disputeId;
    Instant openedAt;
    Instant occurredAt;

    public static final String EVENT_TYPE = "dispute.escalated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return "Dispute";
    }

    public static DisputeEscalatedEvent fromDispute(Dispute dispute) {
        return new DisputeEscalatedEvent(
            UUID.randomUUID(),
            dispute.getTransactionId(),
            dispute.getId(),
            dispute.getOpenedAt(),
            dispute.getEscalatedAt()
        );
    }
}
