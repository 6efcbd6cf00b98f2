package com.flagship.escrow_engine.idempotency;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Deletes idempotency records once their retention window has passed.
 */
@Component
@ConditionalOnProperty(name = "escrow.idempotency.cleanup-enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class IdempotencyCleanupScheduler {

    private final IdempotencyService idempotencyService;
    private final Clock clock;

    @Scheduled(cron = "${escrow.idempotency.cleanup-cron:0 0 3 * * *}")
    public void purgeExpired() {
        try {
            idempotencyService.purgeExpired(clock.instant());
        } catch (RuntimeException e) {
            // Next run retries; expired records are harmless until then
            log.error("Idempotency cleanup failed", e);
        }
    }
}
