package com.flagship.escrow_engine.dispute;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A dispute over one sale. At most one per transaction, ever.
 *
 * The money fields are filled in on resolution and record what each side received.
 */
@Value
public class Dispute {
    UUID id;
    UUID transactionId;
    UUID openerId;
    String reason;
    List<String> evidenceRefs;
    DisputeStatus status;
    DisputeOutcome outcome;
    BigDecimal splitRatio;
    Long buyerAmount;
    Long sellerAmount;
    Long feeAmount;
    String resolutionNote;
    UUID resolverId;
    Instant openedAt;
    Instant resolvedAt;
    Instant escalatedAt;

    public boolean isOpen() {
        return status == DisputeStatus.OPEN;
    }
}
