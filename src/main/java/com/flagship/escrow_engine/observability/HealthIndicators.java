package com.flagship.escrow_engine.observability;

import com.flagship.escrow_engine.outbox.OutboxEventRepository;
import com.flagship.escrow_engine.sweeper.TimeoutSweeper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicators for the engine's collaborators.
 *
 * Redis and Kafka are optional at runtime: the engine keeps moving money without
 * them (idempotency falls back to the database, events wait in the outbox), so
 * their absence is reported as DEGRADED rather than DOWN.
 * The sweeper indicator shows how the last timeout pass went.
 */
public class HealthIndicators {

    /**
     * Unhealthy if too many events are waiting to be relayed.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        static final long BACKLOG_WARNING_THRESHOLD = 1000;
        static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }

    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final ObjectProvider<StringRedisTemplate> redisTemplate;

        public RedisHealthIndicator(ObjectProvider<StringRedisTemplate> redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template == null || template.getConnectionFactory() == null) {
                return degraded("Redis not configured");
            }
            try (RedisConnection connection = template.getConnectionFactory().getConnection()) {
                String result = connection.ping();
                return "PONG".equals(result)
                        ? Health.up().withDetail("response", result).build()
                        : Health.down().withDetail("response", String.valueOf(result)).build();
            } catch (Exception e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private Health degraded(String error) {
            return Health.status("DEGRADED")
                    .withDetail("error", error)
                    .withDetail("note", "Idempotency lookups fall back to the database")
                    .build();
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final ObjectProvider<KafkaTemplate<String, String>> kafkaTemplate;

        public KafkaHealthIndicator(ObjectProvider<KafkaTemplate<String, String>> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            KafkaTemplate<String, String> template = kafkaTemplate.getIfAvailable();
            if (template == null) {
                return Health.status("DEGRADED").withDetail("error", "KafkaTemplate not configured").build();
            }
            try {
                var metrics = template.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.status("DEGRADED")
                            .withDetail("error", "No Kafka connections established")
                            .withDetail("note", "Events wait in the outbox until Kafka is reachable")
                            .build();
                }
                return Health.up().withDetail("metricsCount", metrics.size()).build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    /**
     * Reports the last timeout sweep. Failed items in that pass only warn: they
     * are retried on the next one.
     */
    @Component("sweeperHealth")
    public static class SweeperHealthIndicator implements HealthIndicator {

        private final TimeoutSweeper sweeper;

        public SweeperHealthIndicator(TimeoutSweeper sweeper) {
            this.sweeper = sweeper;
        }

        @Override
        public Health health() {
            return sweeper.lastReport()
                    .map(report -> (report.getFailed() > 0 ? Health.status("WARNING") : Health.up())
                            .withDetail("lastSweepAt", report.getStartedAt().toString())
                            .withDetail("released", report.getReleased())
                            .withDetail("refunded", report.getRefunded())
                            .withDetail("canceled", report.getCanceled())
                            .withDetail("escalated", report.getEscalated())
                            .withDetail("failed", report.getFailed())
                            .build())
                    .orElseGet(() -> Health.unknown().withDetail("note", "No sweep has run yet").build());
        }
    }
}
