package com.flagship.escrow_engine.sweeper;

import com.flagship.escrow_engine.dispute.DisputeResolver;
import com.flagship.escrow_engine.error.StoreUnavailableException;
import com.flagship.escrow_engine.persistence.Deadline;
import com.flagship.escrow_engine.transaction.Actor;
import com.flagship.escrow_engine.transaction.EscrowTransactionService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

/**
 * The sweeper's per-item calls into the engine, each with its own deadline.
 *
 * They go through the same service methods a user request does, so they are
 * just as atomic and leave the same history. Only a transient store failure is
 * retried; a business rejection is returned to the sweeper as is.
 */
@Component
public class SweeperActions {

    private final EscrowTransactionService transactionService;
    private final DisputeResolver disputeResolver;
    private final Clock clock;
    private final Duration itemTimeout;

    public SweeperActions(EscrowTransactionService transactionService,
                          DisputeResolver disputeResolver,
                          Clock clock,
                          @Value("${escrow.sweeper.item-timeout-ms:10000}") long itemTimeoutMs) {
        this.transactionService = transactionService;
        this.disputeResolver = disputeResolver;
        this.clock = clock;
        this.itemTimeout = Duration.ofMillis(itemTimeoutMs);
    }

    @Retryable(retryFor = StoreUnavailableException.class,
            maxAttemptsExpression = "${escrow.sweeper.retry.max-attempts:3}",
            backoff = @Backoff(delayExpression = "${escrow.sweeper.retry.initial-backoff-ms:200}", multiplier = 2))
    public void autoRelease(UUID transactionId) {
        transactionService.confirmDelivery(transactionId, Actor.system(), null, deadline());
    }

    @Retryable(retryFor = StoreUnavailableException.class,
            maxAttemptsExpression = "${escrow.sweeper.retry.max-attempts:3}",
            backoff = @Backoff(delayExpression = "${escrow.sweeper.retry.initial-backoff-ms:200}", multiplier = 2))
    public void refund(UUID transactionId) {
        transactionService.refundOnTimeout(transactionId, deadline());
    }

    @Retryable(retryFor = StoreUnavailableException.class,
            maxAttemptsExpression = "${escrow.sweeper.retry.max-attempts:3}",
            backoff = @Backoff(delayExpression = "${escrow.sweeper.retry.initial-backoff-ms:200}", multiplier = 2))
    public void cancelStuckPayment(UUID transactionId) {
        transactionService.cancel(transactionId, Actor.system(), null, deadline());
    }

    /**
     * @return false if the dispute was escalated before or is already resolved
     */
    @Retryable(retryFor = StoreUnavailableException.class,
            maxAttemptsExpression = "${escrow.sweeper.retry.max-attempts:3}",
            backoff = @Backoff(delayExpression = "${escrow.sweeper.retry.initial-backoff-ms:200}", multiplier = 2))
    public boolean escalate(UUID disputeId) {
        return disputeResolver.escalate(disputeId, deadline());
    }

    private Deadline deadline() {
        return Deadline.after(itemTimeout, clock);
    }
}
