package com.flagship.escrow_engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escrow_engine.ledger.WalletReconciliation;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class ReconciliationResponse {

    @JsonProperty("wallet_id")
    UUID walletId;

    @JsonProperty("stored_available")
    long storedAvailable;

    @JsonProperty("stored_held")
    long storedHeld;

    @JsonProperty("derived_available")
    long derivedAvailable;

    @JsonProperty("derived_held")
    long derivedHeld;

    @JsonProperty("entry_count")
    long entryCount;

    @JsonProperty("balanced")
    boolean balanced;

    public static ReconciliationResponse from(WalletReconciliation reconciliation) {
        return ReconciliationResponse.builder()
            .walletId(reconciliation.getWalletId())
            .storedAvailable(reconciliation.getStoredAvailable())
            .storedHeld(reconciliation.getStoredHeld())
            .derivedAvailable(reconciliation.getDerivedAvailable())
            .derivedHeld(reconciliation.getDerivedHeld())
            .entryCount(reconciliation.getEntryCount())
            .balanced(reconciliation.isBalanced())
            .build();
    }
}
