package com.flagship.escrow_engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escrow_engine.transaction.EscrowTransaction;
import com.flagship.escrow_engine.transaction.TransactionStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("listing_ref")
    String listingRef;

    @JsonProperty("buyer_id")
    UUID buyerId;

    @JsonProperty("seller_id")
    UUID sellerId;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("fee_amount")
    long feeAmount;

    @JsonProperty("status")
    TransactionStatus status;

    @JsonProperty("dispute_id")
    UUID disputeId;

    @JsonProperty("payment_wallet_id")
    UUID paymentWalletId;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("escrow_held_at")
    Instant escrowHeldAt;

    @JsonProperty("closed_at")
    Instant closedAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static TransactionResponse from(EscrowTransaction txn) {
        return TransactionResponse.builder()
            .id(txn.getId())
            .listingRef(txn.getListingRef())
            .buyerId(txn.getBuyerId())
            .sellerId(txn.getSellerId())
            .amount(txn.getAmount())
            .currency(txn.getCurrency().name())
            .feeAmount(txn.getFeeAmount())
            .status(txn.getStatus())
            .disputeId(txn.getDisputeId())
            .paymentWalletId(txn.getPaymentWalletId())
            .createdAt(txn.getCreatedAt())
            .escrowHeldAt(txn.getEscrowHeldAt())
            .closedAt(txn.getClosedAt())
            .updatedAt(txn.getUpdatedAt())
            .build();
    }
}
