package com.flagship.escrow_engine.observability;

import com.flagship.escrow_engine.transaction.TransactionStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Centralized metrics for the escrow engine.
 *
 * Metrics exposed:
 * - escrow.transactions.created: sales created, by currency
 * - escrow.transitions: committed status transitions, by from/to status and actor role
 * - escrow.transitions.rejected: transition attempts refused, by error code
 * - ledger.movements: money movements, by entry reason
 * - escrow.holds: hold lifecycle, by outcome
 * - escrow.disputes: dispute lifecycle, by action/outcome
 * - escrow.sweeper.actions: forced transitions, by action
 * - idempotency.cache: hit/miss
 * - escrow.operation.duration: timer per engine operation
 * - escrow.transactions.in_status: gauge of sales currently in each status
 */
@Component
public class EscrowMetrics {

    private final MeterRegistry registry;

    private final Counter duplicateRequests;
    private final Timer sweepTimer;
    private final Map<TransactionStatus, AtomicLong> statusCounts = new EnumMap<>(TransactionStatus.class);

    public EscrowMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.duplicateRequests = Counter.builder("escrow.duplicate_requests")
                .description("Number of replayed requests answered from an idempotency record")
                .register(registry);

        this.sweepTimer = Timer.builder("escrow.sweeper.duration")
                .description("Time taken by one timeout sweep")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        for (TransactionStatus status : TransactionStatus.values()) {
            AtomicLong count = new AtomicLong();
            statusCounts.put(status, count);
            Gauge.builder("escrow.transactions.in_status", count, AtomicLong::get)
                    .description("Sales currently in the given status")
                    .tag("status", status.name())
                    .register(registry);
        }
    }

    /**
     * Replaces every status gauge; statuses missing from {@code counts} drop to zero.
     */
    public void updateStatusCounts(Map<TransactionStatus, Long> counts) {
        statusCounts.forEach((status, gauge) -> gauge.set(counts.getOrDefault(status, 0L)));
    }

    public long statusCount(TransactionStatus status) {
        return statusCounts.get(status).get();
    }

    public void recordTransactionCreated(String currency) {
        registry.counter("escrow.transactions.created", "currency", sanitizeTag(currency)).increment();
    }

    public void recordTransition(String from, String to, String actorRole) {
        registry.counter("escrow.transitions",
                "from", sanitizeTag(from),
                "to", sanitizeTag(to),
                "actor", sanitizeTag(actorRole)
        ).increment();
    }

    public void recordRejected(String operation, String errorCode) {
        registry.counter("escrow.transitions.rejected",
                "operation", sanitizeTag(operation),
                "code", sanitizeTag(errorCode)
        ).increment();
    }

    public void recordLedgerMovement(String reason, String currency) {
        registry.counter("ledger.movements",
                "reason", sanitizeTag(reason),
                "currency", sanitizeTag(currency)
        ).increment();
    }

    public void recordHold(String outcome) {
        registry.counter("escrow.holds", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordDispute(String action) {
        registry.counter("escrow.disputes", "action", sanitizeTag(action)).increment();
    }

    public void recordSweeperAction(String action) {
        registry.counter("escrow.sweeper.actions", "action", sanitizeTag(action)).increment();
    }

    public void recordIdempotencyHit() {
        duplicateRequests.increment();
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void recordOperationLatency(String operation, Duration duration) {
        registry.timer("escrow.operation.duration", "operation", sanitizeTag(operation)).record(duration);
    }

    public <T> T timeSweep(Supplier<T> sweep) {
        return sweepTimer.record(sweep);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
