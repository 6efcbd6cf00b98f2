package com.flagship.escrow_engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escrow_engine.dispute.DisputeResolver;
import lombok.Value;

@Value
public class DisputeResolutionResponse {

    @JsonProperty("dispute")
    DisputeResponse dispute;

    @JsonProperty("transaction")
    TransactionResponse transaction;

    public static DisputeResolutionResponse from(DisputeResolver.Resolution resolution) {
        return new DisputeResolutionResponse(
            DisputeResponse.from(resolution.getDispute()),
            TransactionResponse.from(resolution.getTransaction()));
    }
}
