package com.flagship.escrow_engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Value;

/**
 * Deposit or withdrawal. {@code reference} is the payment provider's id for the
 * transfer; the same reference is only ever applied once per wallet.
 */
@Value
public class MoneyMovementRequest {

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be greater than 0")
    @JsonProperty("amount")
    Long amount;

    @NotBlank(message = "Reference is required")
    @Size(max = 128, message = "Reference must be at most 128 characters")
    @JsonProperty("reference")
    String reference;
}
