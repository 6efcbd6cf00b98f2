package com.flagship.escrow_engine.error;

public class AlreadyResolvedException extends EscrowException {

    public AlreadyResolvedException(String message) {
        super(ErrorCode.ALREADY_RESOLVED, message);
    }
}
