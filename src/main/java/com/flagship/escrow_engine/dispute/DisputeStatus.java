package com.flagship.escrow_engine.dispute;

public enum DisputeStatus {
    OPEN,
    RESOLVED_BUYER,
    RESOLVED_SELLER,
    RESOLVED_SPLIT;

    public boolean isResolved() {
        return this != OPEN;
    }
}
