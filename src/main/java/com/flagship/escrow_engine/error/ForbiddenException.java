package com.flagship.escrow_engine.error;

public class ForbiddenException extends EscrowException {

    public ForbiddenException(String message) {
        super(ErrorCode.FORBIDDEN, message);
    }
}
