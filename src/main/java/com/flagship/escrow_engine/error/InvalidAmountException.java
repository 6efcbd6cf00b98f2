package com.flagship.escrow_engine.error;

public class InvalidAmountException extends EscrowException {

    public InvalidAmountException(String message) {
        super(ErrorCode.INVALID_AMOUNT, message);
    }
}
