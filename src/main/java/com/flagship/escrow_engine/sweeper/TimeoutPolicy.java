package com.flagship.escrow_engine.sweeper;

/**
 * What happens to escrow nobody confirmed in time.
 */
public enum TimeoutPolicy {
    /** Silence counts as acceptance: the seller is paid. */
    AUTO_RELEASE,
    /** The hold expires back to the buyer and the sale is refunded. */
    AUTO_REFUND
}
