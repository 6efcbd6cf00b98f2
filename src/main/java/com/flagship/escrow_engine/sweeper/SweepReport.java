package com.flagship.escrow_engine.sweeper;

import lombok.Value;

import java.time.Instant;

/**
 * Counts from one sweeper pass. {@code skipped} are items someone else moved
 * between the query and the lock; {@code failed} are items that errored and will be
 * picked up again next pass.
 */
@Value
public class SweepReport {
    Instant startedAt;
    int released;
    int refunded;
    int canceled;
    int escalated;
    int skipped;
    int failed;

    public int total() {
        return released + refunded + canceled + escalated;
    }
}
