package com.flagship.escrow_engine.error;

public class AlreadyDisputedException extends EscrowException {

    public AlreadyDisputedException(String message) {
        super(ErrorCode.ALREADY_DISPUTED, message);
    }
}
