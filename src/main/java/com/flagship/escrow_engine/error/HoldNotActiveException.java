package com.flagship.escrow_engine.error;

public class HoldNotActiveException extends EscrowException {

    public HoldNotActiveException(String message) {
        super(ErrorCode.HOLD_NOT_ACTIVE, message);
    }
}
