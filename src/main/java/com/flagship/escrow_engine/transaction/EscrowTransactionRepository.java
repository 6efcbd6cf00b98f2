package com.flagship.escrow_engine.transaction;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface EscrowTransactionRepository
        extends JpaRepository<EscrowTransactionEntity, UUID>, JpaSpecificationExecutor<EscrowTransactionEntity> {

    /**
     * Loads the row with a write lock held until the end of the transaction.
     * Every state change on a sale goes through this, which serializes them.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM EscrowTransactionEntity t WHERE t.id = :id")
    Optional<EscrowTransactionEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<EscrowTransactionEntity> findByIdempotencyKey(String idempotencyKey);

    /**
     * Sales held in escrow since before {@code cutoff} with no dispute, oldest first.
     */
    @Query("""
        SELECT t.id FROM EscrowTransactionEntity t
        WHERE t.status = com.flagship.escrow_engine.transaction.TransactionStatus.ESCROW_HELD
          AND t.escrowHeldAt < :cutoff AND t.disputeId IS NULL
        ORDER BY t.escrowHeldAt ASC
        """)
    List<UUID> findHeldSince(@Param("cutoff") Instant cutoff, Pageable page);

    /**
     * Sales whose payment started before {@code cutoff} and never reached escrow.
     */
    @Query("""
        SELECT t.id FROM EscrowTransactionEntity t
        WHERE t.status = com.flagship.escrow_engine.transaction.TransactionStatus.PAYMENT_PROCESSING
          AND t.paymentStartedAt < :cutoff
        ORDER BY t.paymentStartedAt ASC
        """)
    List<UUID> findPaymentStuckSince(@Param("cutoff") Instant cutoff, Pageable page);

    /**
     * Row counts per status, as {@code [TransactionStatus, Long]} pairs.
     */
    @Query("SELECT t.status, COUNT(t) FROM EscrowTransactionEntity t GROUP BY t.status")
    List<Object[]> countByStatus();
}
