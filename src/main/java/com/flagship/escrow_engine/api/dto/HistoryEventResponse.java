package com.flagship.escrow_engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escrow_engine.transaction.ActorRole;
import com.flagship.escrow_engine.transaction.TransactionHistoryEvent;
import com.flagship.escrow_engine.transaction.TransactionStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One step of a sale's timeline. {@code from_status} is null for the creation step.
 */
@Value
@Builder
public class HistoryEventResponse {

    @JsonProperty("from_status")
    TransactionStatus fromStatus;

    @JsonProperty("to_status")
    TransactionStatus toStatus;

    @JsonProperty("actor_id")
    UUID actorId;

    @JsonProperty("actor_role")
    ActorRole actorRole;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("occurred_at")
    Instant occurredAt;

    public static HistoryEventResponse from(TransactionHistoryEvent event) {
        return HistoryEventResponse.builder()
            .fromStatus(event.getFromStatus())
            .toStatus(event.getToStatus())
            .actorId(event.getActorId())
            .actorRole(event.getActorRole())
            .reason(event.getReason())
            .occurredAt(event.getOccurredAt())
            .build();
    }
}
