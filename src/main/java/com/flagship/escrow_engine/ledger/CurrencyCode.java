package com.flagship.escrow_engine.ledger;

/**
 * Currency code enum following ISO-4217.
 *
 * Amounts are stored as integer minor units; {@link #getFractionDigits()} says
 * how many of those digits sit after the decimal point when shown to a person.
 */
public enum CurrencyCode {
    USD(2),
    EUR(2),
    GBP(2),
    RUB(2),
    JPY(0),
    CNY(2);

    private final int fractionDigits;

    CurrencyCode(int fractionDigits) {
        this.fractionDigits = fractionDigits;
    }

    public int getFractionDigits() {
        return fractionDigits;
    }

    /**
     * Parses a three-letter code, case-insensitively.
     *
     * @throws IllegalArgumentException for unknown codes
     */
    public static CurrencyCode parse(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Currency is required");
        }
        try {
            return CurrencyCode.valueOf(code.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid currency code: " + code);
        }
    }
}
