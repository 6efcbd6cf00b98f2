package com.flagship.escrow_engine.error;

public class CurrencyMismatchException extends EscrowException {

    public CurrencyMismatchException(String message) {
        super(ErrorCode.CURRENCY_MISMATCH, message);
    }
}
