package com.flagship.escrow_engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.List;

@Value
public class OpenDisputeRequest {

    @NotBlank(message = "Reason is required")
    @Size(max = 2000, message = "Reason must be at most 2000 characters")
    @JsonProperty("reason")
    String reason;

    /** Opaque references to chat messages, photos, tracking numbers. */
    @Size(max = 50, message = "At most 50 evidence references")
    @JsonProperty("evidence_refs")
    List<@NotBlank String> evidenceRefs;
}
