package com.flagship.escrow_engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

/**
 * Opens a sale. Amount is in minor units of the currency (cents for USD).
 */
@Value
public class CreateTransactionRequest {

    @NotNull(message = "Buyer ID is required")
    @JsonProperty("buyer_id")
    UUID buyerId;

    @NotNull(message = "Seller ID is required")
    @JsonProperty("seller_id")
    UUID sellerId;

    @NotBlank(message = "Listing reference is required")
    @Size(max = 128, message = "Listing reference must be at most 128 characters")
    @JsonProperty("listing_ref")
    String listingRef;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be greater than 0")
    @JsonProperty("amount")
    Long amount;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;
}
