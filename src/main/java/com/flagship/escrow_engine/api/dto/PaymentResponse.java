package com.flagship.escrow_engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escrow_engine.transaction.PaymentResult;
import lombok.Value;

@Value
public class PaymentResponse {

    @JsonProperty("transaction")
    TransactionResponse transaction;

    @JsonProperty("hold")
    HoldResponse hold;

    public static PaymentResponse from(PaymentResult result) {
        return new PaymentResponse(
            TransactionResponse.from(result.getTransaction()),
            HoldResponse.from(result.getHold()));
    }
}
