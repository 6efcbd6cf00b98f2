package com.flagship.escrow_engine.observability;

import com.flagship.escrow_engine.transaction.EscrowTransactionRepository;
import com.flagship.escrow_engine.transaction.TransactionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.Map;

/**
 * Refreshes the gauges that need a database query: the outbox backlog and the
 * number of sales sitting in each status.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final EscrowMetrics escrowMetrics;
    private final EscrowTransactionRepository transactionRepository;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshOutboxMetrics() {
        outboxMetrics.refreshMetrics();
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    @Transactional(readOnly = true)
    public void refreshStatusGauges() {
        try {
            Map<TransactionStatus, Long> counts = new EnumMap<>(TransactionStatus.class);
            for (Object[] row : transactionRepository.countByStatus()) {
                counts.put((TransactionStatus) row[0], (Long) row[1]);
            }
            escrowMetrics.updateStatusCounts(counts);
        } catch (RuntimeException e) {
            // Gauges keep their last value until the next refresh
            log.warn("Failed to refresh status gauges: {}", e.getMessage());
        }
    }
}
