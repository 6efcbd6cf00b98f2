package com.flagship.escrow_engine.sweeper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives {@link TimeoutSweeper} on a fixed delay, so passes never overlap on one node.
 * Several nodes may sweep at once; row locks decide who moves each item.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "escrow.sweeper.enabled", havingValue = "true", matchIfMissing = true)
public class TimeoutSweeperScheduler {

    private final TimeoutSweeper sweeper;

    @Scheduled(fixedDelayString = "${escrow.sweeper.interval-ms:60000}",
               initialDelayString = "${escrow.sweeper.initial-delay-ms:10000}")
    public void runSweep() {
        try {
            sweeper.sweep();
        } catch (RuntimeException e) {
            log.error("Sweeper pass aborted", e);
        }
    }
}
