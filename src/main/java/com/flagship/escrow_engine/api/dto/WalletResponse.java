package com.flagship.escrow_engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escrow_engine.ledger.Wallet;
import com.flagship.escrow_engine.ledger.WalletKind;
import com.flagship.escrow_engine.ledger.WalletStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class WalletResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("owner_id")
    UUID ownerId;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("kind")
    WalletKind kind;

    @JsonProperty("available_balance")
    long availableBalance;

    @JsonProperty("held_balance")
    long heldBalance;

    @JsonProperty("status")
    WalletStatus status;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static WalletResponse from(Wallet wallet) {
        return WalletResponse.builder()
            .id(wallet.getId())
            .ownerId(wallet.getOwnerId())
            .currency(wallet.getCurrency().name())
            .kind(wallet.getKind())
            .availableBalance(wallet.getAvailableBalance())
            .heldBalance(wallet.getHeldBalance())
            .status(wallet.getStatus())
            .createdAt(wallet.getCreatedAt())
            .updatedAt(wallet.getUpdatedAt())
            .build();
    }
}
