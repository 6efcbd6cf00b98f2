package com.flagship.escrow_engine.transaction;

import java.math.BigInteger;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Platform fee charged on a completed sale, in basis points of the amount.
 * The fee is fixed when the transaction is created.
 */
@Component
public class FeePolicy {

    private static final long BPS_DENOMINATOR = 10_000L;
    private static final BigInteger BPS = BigInteger.valueOf(BPS_DENOMINATOR);

    private final long percentageBps;
    private final boolean enabled;

    public FeePolicy(@Value("${escrow.fee.percentage-bps:500}") long percentageBps,
                     @Value("${escrow.fee.enabled:true}") boolean enabled) {
        if (percentageBps < 0 || percentageBps >= BPS_DENOMINATOR) {
            throw new IllegalArgumentException("Fee must be in [0, 10000) bps, got " + percentageBps);
        }
        this.percentageBps = percentageBps;
        this.enabled = enabled;
    }

    /**
     * Fee for a sale of {@code amount} minor units, rounded down.
     */
    public long feeFor(long amount) {
        if (!enabled) {
            return 0;
        }
        // the product can exceed a long; the quotient never exceeds amount
        return BigInteger.valueOf(amount)
                .multiply(BigInteger.valueOf(percentageBps))
                .divide(BPS)
                .longValueExact();
    }

    /**
     * Share of the fee charged when the seller receives only {@code sellerShare} of {@code amount}.
     * Rounded down, so the platform never takes more than the proportional cut.
     */
    public static long proportionalFee(long feeAmount, long sellerShare, long amount) {
        return BigInteger.valueOf(feeAmount)
                .multiply(BigInteger.valueOf(sellerShare))
                .divide(BigInteger.valueOf(amount))
                .longValueExact();
    }
}
