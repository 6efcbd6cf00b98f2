package com.flagship.escrow_engine.transaction;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface TransactionHistoryRepository extends JpaRepository<TransactionHistoryEntity, Long> {

    List<TransactionHistoryEntity> findByTransactionIdOrderByIdAsc(UUID transactionId);
}
