package com.flagship.escrow_engine.error;

public class DeadlineExceededException extends EscrowException {

    public DeadlineExceededException(String message) {
        super(ErrorCode.DEADLINE_EXCEEDED, message);
    }
}
