package com.flagship.escrow_engine.transaction;

import com.flagship.escrow_engine.ledger.CurrencyCode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for escrow_transactions.
 *
 * No setters: the only ways in are {@link #fromDomain} and {@link #updateFromDomain},
 * and the latter only touches the fields a transition may change. Parties, amount,
 * currency and fee are fixed at creation.
 *
 * The creation idempotency key is a persistence concern and lives only here.
 */
@Entity
@Table(
    name = "escrow_transactions",
    indexes = {
        @Index(name = "idx_escrow_transactions_buyer", columnList = "buyer_id"),
        @Index(name = "idx_escrow_transactions_seller", columnList = "seller_id"),
        @Index(name = "idx_escrow_transactions_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EscrowTransactionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "listing_ref", updatable = false)
    private String listingRef;

    @Column(name = "buyer_id", nullable = false, updatable = false)
    private UUID buyerId;

    @Column(name = "seller_id", nullable = false, updatable = false)
    private UUID sellerId;

    @Column(nullable = false, updatable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Column(name = "fee_amount", nullable = false, updatable = false)
    private long feeAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private TransactionStatus status;

    @Column(name = "dispute_id")
    private UUID disputeId;

    @Column(name = "payment_wallet_id")
    private UUID paymentWalletId;

    @Column(name = "payment_attempt_key")
    private String paymentAttemptKey;

    @Column(name = "idempotency_key", unique = true, updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "payment_started_at")
    private Instant paymentStartedAt;

    @Column(name = "escrow_held_at")
    private Instant escrowHeldAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    static EscrowTransactionEntity fromDomain(EscrowTransaction txn, String idempotencyKey) {
        return new EscrowTransactionEntity(
            txn.getId(),
            txn.getListingRef(),
            txn.getBuyerId(),
            txn.getSellerId(),
            txn.getAmount(),
            txn.getCurrency(),
            txn.getFeeAmount(),
            txn.getStatus(),
            txn.getDisputeId(),
            txn.getPaymentWalletId(),
            txn.getPaymentAttemptKey(),
            idempotencyKey,
            txn.getCreatedAt(),
            txn.getPaymentStartedAt(),
            txn.getEscrowHeldAt(),
            txn.getClosedAt(),
            txn.getUpdatedAt(),
            null   // assigned on insert
        );
    }

    public EscrowTransaction toDomain() {
        return new EscrowTransaction(
            id,
            listingRef,
            buyerId,
            sellerId,
            amount,
            currency,
            feeAmount,
            status,
            disputeId,
            paymentWalletId,
            paymentAttemptKey,
            createdAt,
            paymentStartedAt,
            escrowHeldAt,
            closedAt,
            updatedAt,
            version
        );
    }

    void updateFromDomain(EscrowTransaction txn) {
        this.status = txn.getStatus();
        this.disputeId = txn.getDisputeId();
        this.paymentWalletId = txn.getPaymentWalletId();
        this.paymentAttemptKey = txn.getPaymentAttemptKey();
        this.paymentStartedAt = txn.getPaymentStartedAt();
        this.escrowHeldAt = txn.getEscrowHeldAt();
        this.closedAt = txn.getClosedAt();
        this.updatedAt = txn.getUpdatedAt();
    }
}
