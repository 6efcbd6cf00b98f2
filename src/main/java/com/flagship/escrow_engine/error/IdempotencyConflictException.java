package com.flagship.escrow_engine.error;

/**
 * An idempotency key was reused for a different operation or different arguments.
 */
public class IdempotencyConflictException extends EscrowException {

    public IdempotencyConflictException(String message) {
        super(ErrorCode.IDEMPOTENCY_CONFLICT, message);
    }
}
