package com.flagship.escrow_engine.event;

import com.flagship.escrow_engine.dispute.Dispute;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a moderator decides a dispute. Carries what each side received,
 * in minor units of the sale's currency.
 */
@Value
public class DisputeResolvedEvent implements EscrowEvent {
    UUID eventId;
    UUID transactionId;
    UUID disputeId;
    String outcome;
    long buyerAmount;
    long sellerAmount;
    long feeAmount;
    UUID resolverId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "dispute.resolved";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return "Dispute";
    }

    public static DisputeResolvedEvent fromDispute(Dispute dispute) {
        return new DisputeResolvedEvent(
            UUID.randomUUID(),
            dispute.getTransactionId(),
            dispute.getId(),
            dispute.getOutcome().name(),
            dispute.getBuyerAmount(),
            dispute.getSellerAmount(),
            dispute.getFeeAmount(),
            dispute.getResolverId(),
            dispute.getResolvedAt()
        );
    }
}
