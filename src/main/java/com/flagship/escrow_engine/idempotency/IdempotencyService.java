package com.flagship.escrow_engine.idempotency;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.escrow_engine.error.IdempotencyConflictException;
import com.flagship.escrow_engine.observability.EscrowMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotency records for keyed engine calls.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the database, which is the source of truth
 * 3. Records are written in the same transaction as the call's effects and
 *    copied to Redis only after that transaction commits
 *
 * Keeps working with Redis down or not configured at all.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:";

    private final IdempotencyRecordRepository repository;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final ObjectMapper objectMapper;
    private final EscrowMetrics metrics;
    private final Clock clock;
    private final Duration ttl;

    public IdempotencyService(IdempotencyRecordRepository repository,
                              Optional<StringRedisTemplate> redisTemplate,
                              ObjectMapper objectMapper,
                              EscrowMetrics metrics,
                              Clock clock,
                              @Value("${escrow.idempotency.ttl:P7D}") Duration ttl) {
        this.repository = repository;
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.clock = clock;
        this.ttl = ttl;
    }

    /**
     * Looks up a previous result for {@code key}.
     *
     * @return the record if this exact call already completed, empty if the key is unused
     * @throws IdempotencyConflictException if the key was used for a different call
     */
    @Transactional(propagation = Propagation.SUPPORTS)
    public Optional<IdempotencyRecord> find(String key, String operation, String fingerprint) {
        requireKey(key);
        Instant now = clock.instant();

        Optional<IdempotencyRecord> record = readFromRedis(key)
            .or(() -> repository.findById(key).map(IdempotencyRecordEntity::toDomain).map(found -> {
                cacheInRedis(found);
                return found;
            }))
            .filter(found -> !found.isExpired(now));

        if (record.isEmpty()) {
            metrics.recordIdempotencyMiss();
            return Optional.empty();
        }
        if (!record.get().matches(operation, fingerprint)) {
            log.warn("Idempotency key {} reused: stored {} [{}], got {} [{}]",
                key, record.get().getOperation(), record.get().getFingerprint(), operation, fingerprint);
            throw new IdempotencyConflictException("Idempotency key was already used for a different request");
        }
        metrics.recordIdempotencyHit();
        log.info("Idempotency key {} already completed {}, replaying", key, operation);
        return record;
    }

    /**
     * Records the result of a keyed call. Must run inside the call's own transaction,
     * so the record exists if and only if the effects do.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public IdempotencyRecord save(String key, String operation, String fingerprint,
                                  UUID transactionId, UUID holdId, UUID disputeId) {
        requireKey(key);
        Instant now = clock.instant();
        IdempotencyRecord record = new IdempotencyRecord(
            key, operation, fingerprint, transactionId, holdId, disputeId, now, now.plus(ttl));
        repository.save(IdempotencyRecordEntity.fromDomain(record));

        if (redisTemplate.isPresent() && TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    cacheInRedis(record);
                }
            });
        }
        return record;
    }

    /**
     * Deletes expired records. Redis entries expire on their own TTL.
     */
    @Transactional
    public int purgeExpired(Instant now) {
        int deleted = repository.deleteExpired(now);
        if (deleted > 0) {
            log.info("Purged {} expired idempotency records", deleted);
        }
        return deleted;
    }

    private Optional<IdempotencyRecord> readFromRedis(String key) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String json = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + key);
            if (json == null) {
                return Optional.empty();
            }
            log.debug("Idempotency key found in Redis: {}", key);
            return Optional.of(objectMapper.readValue(json, IdempotencyRecord.class));
        } catch (Exception e) {
            log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                key, e.getMessage());
            return Optional.empty();
        }
    }

    private void cacheInRedis(IdempotencyRecord record) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        Duration remaining = Duration.between(clock.instant(), record.getExpiresAt());
        if (remaining.isNegative() || remaining.isZero()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue()
                .set(REDIS_KEY_PREFIX + record.getKey(), objectMapper.writeValueAsString(record), remaining);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize idempotency record", e);
        } catch (RuntimeException e) {
            // Database copy is authoritative; Redis is only a cache
            log.warn("Failed to cache idempotency key in Redis: {}. Error: {}", record.getKey(), e.getMessage());
        }
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
