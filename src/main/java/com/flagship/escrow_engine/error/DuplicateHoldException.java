package com.flagship.escrow_engine.error;

public class DuplicateHoldException extends EscrowException {

    public DuplicateHoldException(String message) {
        super(ErrorCode.DUPLICATE_HOLD, message);
    }
}
