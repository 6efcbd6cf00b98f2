package com.flagship.escrow_engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escrow_engine.ledger.EntryReason;
import com.flagship.escrow_engine.ledger.LedgerEntry;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class LedgerEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("available_delta")
    long availableDelta;

    @JsonProperty("held_delta")
    long heldDelta;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("reason")
    EntryReason reason;

    @JsonProperty("txn_ref")
    String txnRef;

    @JsonProperty("description")
    String description;

    @JsonProperty("created_at")
    Instant createdAt;

    public static LedgerEntryResponse from(LedgerEntry entry) {
        return LedgerEntryResponse.builder()
            .id(entry.getId())
            .amount(entry.getAmount())
            .availableDelta(entry.getAvailableDelta())
            .heldDelta(entry.getHeldDelta())
            .currency(entry.getCurrency().name())
            .reason(entry.getReason())
            .txnRef(entry.getTxnRef())
            .description(entry.getDescription())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
