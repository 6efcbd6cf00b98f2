package com.flagship.escrow_engine.dispute;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for disputes. State changes only through {@link #resolve} and {@link #markEscalated}.
 */
@Entity
@Table(name = "disputes")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DisputeEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "transaction_id", nullable = false, unique = true, updatable = false)
    private UUID transactionId;

    @Column(name = "opener_id", nullable = false, updatable = false)
    private UUID openerId;

    @Column(nullable = false, updatable = false, columnDefinition = "TEXT")
    private String reason;

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "dispute_evidence_refs", joinColumns = @JoinColumn(name = "dispute_id"))
    @OrderColumn(name = "position")
    @Column(name = "evidence_ref", nullable = false)
    private List<String> evidenceRefs = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private DisputeStatus status;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private DisputeOutcome outcome;

    @Column(name = "split_ratio", precision = 5, scale = 4)
    private BigDecimal splitRatio;

    @Column(name = "buyer_amount")
    private Long buyerAmount;

    @Column(name = "seller_amount")
    private Long sellerAmount;

    @Column(name = "fee_amount")
    private Long feeAmount;

    @Column(name = "resolution_note", columnDefinition = "TEXT")
    private String resolutionNote;

    @Column(name = "resolver_id")
    private UUID resolverId;

    @Column(name = "opened_at", nullable = false, updatable = false)
    private Instant openedAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "escalated_at")
    private Instant escalatedAt;

    @Version
    private Long version;

    static DisputeEntity open(UUID transactionId, UUID openerId, String reason, List<String> evidenceRefs, Instant now) {
        DisputeEntity entity = new DisputeEntity();
        entity.id = UUID.randomUUID();
        entity.transactionId = transactionId;
        entity.openerId = openerId;
        entity.reason = reason;
        entity.evidenceRefs = new ArrayList<>(evidenceRefs);
        entity.status = DisputeStatus.OPEN;
        entity.openedAt = now;
        return entity;
    }

    void resolve(DisputeOutcome outcome, BigDecimal splitRatio, long buyerAmount, long sellerAmount, long feeAmount,
                 String note, UUID resolverId, Instant now) {
        if (status.isResolved()) {
            throw new IllegalStateException("Dispute " + id + " is already " + status);
        }
        this.status = outcome.getDisputeStatus();
        this.outcome = outcome;
        this.splitRatio = splitRatio;
        this.buyerAmount = buyerAmount;
        this.sellerAmount = sellerAmount;
        this.feeAmount = feeAmount;
        this.resolutionNote = note;
        this.resolverId = resolverId;
        this.resolvedAt = now;
    }

    /**
     * @return false if the dispute was already escalated or is no longer open
     */
    boolean markEscalated(Instant now) {
        if (status.isResolved() || escalatedAt != null) {
            return false;
        }
        this.escalatedAt = now;
        return true;
    }

    public Dispute toDomain() {
        return new Dispute(
            id,
            transactionId,
            openerId,
            reason,
            List.copyOf(evidenceRefs),
            status,
            outcome,
            splitRatio,
            buyerAmount,
            sellerAmount,
            feeAmount,
            resolutionNote,
            resolverId,
            openedAt,
            resolvedAt,
            escalatedAt
        );
    }
}
