package com.flagship.escrow_engine.error;

import lombok.Getter;

import java.util.UUID;

@Getter
public class InsufficientFundsException extends EscrowException {

    private final UUID walletId;
    private final long requested;
    private final long available;

    public InsufficientFundsException(UUID walletId, long requested, long available) {
        super(ErrorCode.INSUFFICIENT_FUNDS,
                String.format("Wallet %s has %d available, %d requested", walletId, available, requested));
        this.walletId = walletId;
        this.requested = requested;
        this.available = available;
    }
}
