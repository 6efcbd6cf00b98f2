package com.flagship.escrow_engine.transaction;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only: every column is {@code updatable = false}, and a database trigger
 * rejects UPDATE and DELETE on the table.
 */
@Entity
@Table(
    name = "transaction_history",
    indexes = @Index(name = "idx_transaction_history_txn", columnList = "transaction_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TransactionHistoryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "transaction_id", nullable = false, updatable = false)
    private UUID transactionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_status", length = 32, updatable = false)
    private TransactionStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_status", nullable = false, length = 32, updatable = false)
    private TransactionStatus toStatus;

    @Column(name = "actor_id", nullable = false, updatable = false)
    private UUID actorId;

    @Enumerated(EnumType.STRING)
    @Column(name = "actor_role", nullable = false, length = 16, updatable = false)
    private ActorRole actorRole;

    @Column(name = "reason", updatable = false)
    private String reason;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    static TransactionHistoryEntity record(UUID transactionId, TransactionStatus from, TransactionStatus to,
                                           Actor actor, String reason, Instant occurredAt) {
        TransactionHistoryEntity entity = new TransactionHistoryEntity();
        entity.transactionId = transactionId;
        entity.fromStatus = from;
        entity.toStatus = to;
        entity.actorId = actor.getId();
        entity.actorRole = actor.getRole();
        entity.reason = reason;
        entity.occurredAt = occurredAt;
        return entity;
    }

    public TransactionHistoryEvent toDomain() {
        return new TransactionHistoryEvent(id, transactionId, fromStatus, toStatus, actorId, actorRole, reason, occurredAt);
    }
}
