package com.flagship.escrow_engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class InitiatePaymentRequest {

    @NotNull(message = "Wallet ID is required")
    @JsonProperty("wallet_id")
    UUID walletId;
}
