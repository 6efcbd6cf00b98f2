package com.flagship.escrow_engine.ledger;

import lombok.Value;

/**
 * System-wide totals for one currency, used to check conservation of money:
 * the sum of all wallet balances must equal deposits minus withdrawals.
 */
@Value
public class CurrencyTotals {
    CurrencyCode currency;
    long totalAvailable;
    long totalHeld;
    long netExternalFlow;

    public boolean isConserved() {
        return totalAvailable + totalHeld == netExternalFlow;
    }
}
