package com.flagship.escrow_engine.error;

public class SamePartyException extends EscrowException {

    public SamePartyException(String message) {
        super(ErrorCode.SAME_PARTY, message);
    }
}
