package com.flagship.escrow_engine.dispute;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DisputeRepository extends JpaRepository<DisputeEntity, UUID> {

    Optional<DisputeEntity> findByTransactionId(UUID transactionId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM DisputeEntity d WHERE d.id = :id")
    Optional<DisputeEntity> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Open, not yet escalated disputes opened before {@code cutoff}, oldest first.
     */
    @Query("""
        SELECT d.id FROM DisputeEntity d
        WHERE d.status = com.flagship.escrow_engine.dispute.DisputeStatus.OPEN
          AND d.escalatedAt IS NULL AND d.openedAt < :cutoff
        ORDER BY d.openedAt ASC
        """)
    List<UUID> findDueForEscalation(@Param("cutoff") Instant cutoff, Pageable page);
}
