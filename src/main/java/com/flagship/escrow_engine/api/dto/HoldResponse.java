package com.flagship.escrow_engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escrow_engine.hold.Hold;
import com.flagship.escrow_engine.hold.HoldStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class HoldResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("wallet_id")
    UUID walletId;

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("released_amount")
    long releasedAmount;

    @JsonProperty("captured_amount")
    long capturedAmount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("status")
    HoldStatus status;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("expires_at")
    Instant expiresAt;

    @JsonProperty("resolved_at")
    Instant resolvedAt;

    public static HoldResponse from(Hold hold) {
        return HoldResponse.builder()
            .id(hold.getId())
            .walletId(hold.getWalletId())
            .transactionId(hold.getTransactionId())
            .amount(hold.getAmount())
            .releasedAmount(hold.getReleasedAmount())
            .capturedAmount(hold.getCapturedAmount())
            .currency(hold.getCurrency().name())
            .status(hold.getStatus())
            .createdAt(hold.getCreatedAt())
            .expiresAt(hold.getExpiresAt())
            .resolvedAt(hold.getResolvedAt())
            .build();
    }
}
