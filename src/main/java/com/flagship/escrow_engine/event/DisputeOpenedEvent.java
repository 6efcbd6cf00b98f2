package com.flagship.escrow_engine.event;

import com.flagship.escrow_engine.dispute.Dispute;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
public class DisputeOpenedEvent implements EscrowEvent {
    UUID eventId;
    UUID transactionId;
    UUID disputeId;
    UUID openerId;
    String reason;
    List<String> evidenceRefs;
    Instant occurredAt;

    public static final String EVENT_TYPE = "dispute.opened";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return "Dispute";
    }

    public static DisputeOpenedEvent fromDispute(Dispute dispute) {
        return new DisputeOpenedEvent(
            UUID.randomUUID(),
            dispute.getTransactionId(),
            dispute.getId(),
            dispute.getOpenerId(),
            dispute.getReason(),
            dispute.getEvidenceRefs(),
            dispute.getOpenedAt()
        );
    }
}
