package com.flagship.escrow_engine.observability;

import com.flagship.escrow_engine.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox gauges: total backlog, backlog per aggregate (sale events and dispute
 * events go to different topics), age of the oldest waiting event and the
 * dead-letter count. Refreshed by {@link MetricsScheduler}, so a scrape reads
 * cached values only.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    static final List<String> AGGREGATE_TYPES = List.of("Transaction", "Dispute");

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    private final AtomicLong backlogSize = new AtomicLong();
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong();
    private final AtomicLong deadLetterCount = new AtomicLong();
    private final Map<String, AtomicLong> backlogByAggregate = new HashMap<>();

    @PostConstruct
    public void init() {
        Gauge.builder("outbox.backlog.size", backlogSize, AtomicLong::get)
                .description("Events written but not yet relayed to Kafka")
                .register(meterRegistry);

        for (String aggregateType : AGGREGATE_TYPES) {
            AtomicLong count = new AtomicLong();
            backlogByAggregate.put(aggregateType, count);
            Gauge.builder("outbox.backlog.by_aggregate", count, AtomicLong::get)
                    .description("Events waiting to be relayed, per aggregate type")
                    .tag("aggregate", aggregateType)
                    .register(meterRegistry);
        }

        Gauge.builder("outbox.backlog.age.seconds", oldestEventAgeSeconds, AtomicLong::get)
                .description("Seconds since the oldest waiting event was written")
                .register(meterRegistry);

        Gauge.builder("outbox.events.failed", deadLetterCount, AtomicLong::get)
                .description("Events the relay gave up on after max retries")
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            backlogSize.set(outboxRepository.countUnpublished());

            Map<String, Long> perAggregate = new HashMap<>();
            for (Object[] row : outboxRepository.countUnpublishedByAggregateType()) {
                perAggregate.put((String) row[0], (Long) row[1]);
            }
            backlogByAggregate.forEach((type, gauge) -> gauge.set(perAggregate.getOrDefault(type, 0L)));

            oldestEventAgeSeconds.set(outboxRepository.findOldestUnpublishedCreatedAt()
                    .map(oldest -> Math.max(0, Duration.between(oldest, clock.instant()).getSeconds()))
                    .orElse(0L));

            deadLetterCount.set(outboxRepository.countDeadLetters(maxRetries));

            log.debug("Outbox metrics refreshed: backlog={}, byAggregate={}, oldestAge={}s, failed={}",
                    backlogSize.get(), perAggregate, oldestEventAgeSeconds.get(), deadLetterCount.get());
        } catch (RuntimeException e) {
            // Gauges keep their last value until the next refresh
            log.warn("Failed to refresh outbox metrics: {}", e.getMessage());
        }
    }

    public long getBacklogSize(String aggregateType) {
        AtomicLong gauge = backlogByAggregate.get(aggregateType);
        return gauge != null ? gauge.get() : 0;
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("outbox.events.published", "event_type", eventType, "status", "success").increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("outbox.events.published", "event_type", eventType, "status", "failure").increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("outbox.events.dead_lettered", "event_type", eventType).increment();
    }
}
