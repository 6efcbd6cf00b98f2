package com.flagship.escrow_engine.error;

/**
 * Transient infrastructure failure. Safe to retry with the same idempotency key.
 */
public class StoreUnavailableException extends EscrowException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(ErrorCode.STORE_UNAVAILABLE, message, cause);
    }
}
