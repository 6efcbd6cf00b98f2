package com.flagship.escrow_engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escrow_engine.dispute.Dispute;
import com.flagship.escrow_engine.dispute.DisputeOutcome;
import com.flagship.escrow_engine.dispute.DisputeStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class DisputeResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("opener_id")
    UUID openerId;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("evidence_refs")
    List<String> evidenceRefs;

    @JsonProperty("status")
    DisputeStatus status;

    @JsonProperty("outcome")
    DisputeOutcome outcome;

    @JsonProperty("split_ratio")
    BigDecimal splitRatio;

    @JsonProperty("buyer_amount")
    Long buyerAmount;

    @JsonProperty("seller_amount")
    Long sellerAmount;

    @JsonProperty("fee_amount")
    Long feeAmount;

    @JsonProperty("resolution_note")
    String resolutionNote;

    @JsonProperty("resolver_id")
    UUID resolverId;

    @JsonProperty("opened_at")
    Instant openedAt;

    @JsonProperty("resolved_at")
    Instant resolvedAt;

    @JsonProperty("escalated_at")
    Instant escalatedAt;

    public static DisputeResponse from(Dispute dispute) {
        return DisputeResponse.builder()
            .id(dispute.getId())
            .transactionId(dispute.getTransactionId())
            .openerId(dispute.getOpenerId())
            .reason(dispute.getReason())
            .evidenceRefs(dispute.getEvidenceRefs())
            .status(dispute.getStatus())
            .outcome(dispute.getOutcome())
            .splitRatio(dispute.getSplitRatio())
            .buyerAmount(dispute.getBuyerAmount())
            .sellerAmount(dispute.getSellerAmount())
            .feeAmount(dispute.getFeeAmount())
            .resolutionNote(dispute.getResolutionNote())
            .resolverId(dispute.getResolverId())
            .openedAt(dispute.getOpenedAt())
            .resolvedAt(dispute.getResolvedAt())
            .escalatedAt(dispute.getEscalatedAt())
            .build();
    }
}
