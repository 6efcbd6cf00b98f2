package com.flagship.escrow_engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escrow_engine.dispute.DisputeOutcome;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A moderator's decision. {@code split_ratio} is the buyer's share and only
 * applies to the SPLIT outcome.
 */
@Value
public class ResolveDisputeRequest {

    @NotNull(message = "Outcome is required")
    @JsonProperty("outcome")
    DisputeOutcome outcome;

    @DecimalMin(value = "0", inclusive = false, message = "Split ratio must be greater than 0")
    @DecimalMax(value = "1", inclusive = false, message = "Split ratio must be less than 1")
    @JsonProperty("split_ratio")
    BigDecimal splitRatio;

    @Size(max = 2000, message = "Note must be at most 2000 characters")
    @JsonProperty("note")
    String note;
}
