package com.flagship.escrow_engine.transaction;

import com.flagship.escrow_engine.error.InvalidAmountException;
import com.flagship.escrow_engine.error.SamePartyException;
import com.flagship.escrow_engine.ledger.CurrencyCode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * The sale: the central aggregate whose financial state this engine owns.
 *
 * Immutable; a transition produces a new instance through {@link #withStatus}.
 * Only {@link TransactionStateMachine} decides whether a transition is legal.
 */
@Value
@Builder(toBuilder = true)
public class EscrowTransaction {
    UUID id;
    String listingRef;
    UUID buyerId;
    UUID sellerId;
    long amount;
    CurrencyCode currency;
    long feeAmount;
    TransactionStatus status;
    UUID disputeId;
    /** Wallet the buyer paid (or is paying) with. */
    UUID paymentWalletId;
    /** Idempotency key of the payment attempt in flight, so a retry can resume it. */
    String paymentAttemptKey;
    Instant createdAt;
    Instant paymentStartedAt;
    Instant escrowHeldAt;
    Instant closedAt;
    Instant updatedAt;
    Long version;

    /**
     * Creates a new sale in PENDING.
     *
     * @throws InvalidAmountException if amount is not positive
     * @throws SamePartyException if buyer and seller are the same user
     */
    public static EscrowTransaction create(String listingRef, UUID buyerId, UUID sellerId,
                                           long amount, CurrencyCode currency, long feeAmount, Instant now) {
        if (amount <= 0) {
            throw new InvalidAmountException("Amount must be positive, got " + amount);
        }
        if (buyerId.equals(sellerId)) {
            throw new SamePartyException("Buyer and seller must be different users");
        }
        return EscrowTransaction.builder()
            .id(UUID.randomUUID())
            .listingRef(listingRef)
            .buyerId(buyerId)
            .sellerId(sellerId)
            .amount(amount)
            .currency(currency)
            .feeAmount(feeAmount)
            .status(TransactionStatus.PENDING)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Copy in the target status, with the matching milestone timestamp set.
     */
    public EscrowTransaction withStatus(TransactionStatus target, Instant now) {
        EscrowTransactionBuilder next = toBuilder().status(target).updatedAt(now);
        switch (target) {
            case PAYMENT_PROCESSING -> next.paymentStartedAt(now);
            case ESCROW_HELD -> next.escrowHeldAt(now);
            case PENDING -> next.paymentStartedAt(null).paymentAttemptKey(null);
            default -> {
                if (target.isTerminal()) {
                    next.closedAt(now);
                }
            }
        }
        return next.build();
    }

    public boolean isBuyer(UUID userId) {
        return buyerId.equals(userId);
    }

    public boolean isSeller(UUID userId) {
        return sellerId.equals(userId);
    }

    public boolean isParty(UUID userId) {
        return isBuyer(userId) || isSeller(userId);
    }
}
