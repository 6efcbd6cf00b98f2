package com.flagship.escrow_engine.idempotency;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "idempotency_records",
    indexes = @Index(name = "idx_idempotency_records_expires_at", columnList = "expires_at")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class IdempotencyRecordEntity {

    @Id
    @Column(name = "idempotency_key", nullable = false, updatable = false)
    private String key;

    @Column(nullable = false, updatable = false, length = 64)
    private String operation;

    @Column(nullable = false, updatable = false, length = 512)
    private String fingerprint;

    @Column(name = "transaction_id", updatable = false)
    private UUID transactionId;

    @Column(name = "hold_id", updatable = false)
    private UUID holdId;

    @Column(name = "dispute_id", updatable = false)
    private UUID disputeId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    static IdempotencyRecordEntity fromDomain(IdempotencyRecord record) {
        return new IdempotencyRecordEntity(
            record.getKey(),
            record.getOperation(),
            record.getFingerprint(),
            record.getTransactionId(),
            record.getHoldId(),
            record.getDisputeId(),
            record.getCreatedAt(),
            record.getExpiresAt()
        );
    }

    public IdempotencyRecord toDomain() {
        return new IdempotencyRecord(key, operation, fingerprint, transactionId, holdId, disputeId, createdAt, expiresAt);
    }
}
