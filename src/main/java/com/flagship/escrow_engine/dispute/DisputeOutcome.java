package com.flagship.escrow_engine.dispute;

import com.flagship.escrow_engine.transaction.TransactionStatus;

/**
 * A moderator's decision on where the held funds go.
 */
public enum DisputeOutcome {
    /** Everything back to the buyer. */
    BUYER(DisputeStatus.RESOLVED_BUYER, TransactionStatus.RESOLVED_BUYER),
    /** Everything to the seller, minus the full fee. */
    SELLER(DisputeStatus.RESOLVED_SELLER, TransactionStatus.RESOLVED_SELLER),
    /** The split ratio back to the buyer, the rest to the seller minus a proportional fee. */
    SPLIT(DisputeStatus.RESOLVED_SPLIT, TransactionStatus.RESOLVED_SPLIT);

    private final DisputeStatus disputeStatus;
    private final TransactionStatus transactionStatus;

    DisputeOutcome(DisputeStatus disputeStatus, TransactionStatus transactionStatus) {
        this.disputeStatus = disputeStatus;
        this.transactionStatus = transactionStatus;
    }

    public DisputeStatus getDisputeStatus() {
        return disputeStatus;
    }

    public TransactionStatus getTransactionStatus() {
        return transactionStatus;
    }
}
