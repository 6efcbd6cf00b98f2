package com.flagship.escrow_engine.error;

public class NotFoundException extends EscrowException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public static NotFoundException of(String kind, Object id) {
        return new NotFoundException(kind + " not found: " + id);
    }
}
