package com.flagship.escrow_engine.sweeper;

import com.flagship.escrow_engine.dispute.DisputeResolver;
import com.flagship.escrow_engine.error.InvalidStateTransitionException;
import com.flagship.escrow_engine.error.HoldNotActiveException;
import com.flagship.escrow_engine.observability.CorrelationContext;
import com.flagship.escrow_engine.observability.EscrowMetrics;
import com.flagship.escrow_engine.persistence.Deadline;
import com.flagship.escrow_engine.transaction.EscrowTransactionService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Periodic pass over everything waiting on a clock:
 * escrow nobody confirmed, payments that never finished, and disputes past their SLA.
 *
 * Disputes are only ever escalated here, never resolved; splitting money always
 * takes a moderator's decision. One failing item never stops the pass.
 */
@Service
@Slf4j
public class TimeoutSweeper {

    private final EscrowTransactionService transactionService;
    private final DisputeResolver disputeResolver;
    private final SweeperActions actions;
    private final EscrowMetrics metrics;
    private final Clock clock;

    private final Duration deliveryConfirmationTimeout;
    private final Duration paymentProcessingTimeout;
    private final Duration disputeSla;
    private final TimeoutPolicy policy;
    private final int batchSize;
    private final AtomicReference<SweepReport> lastReport = new AtomicReference<>();

    public TimeoutSweeper(EscrowTransactionService transactionService,
                          DisputeResolver disputeResolver,
                          SweeperActions actions,
                          EscrowMetrics metrics,
                          Clock clock,
                          @Value("${escrow.timeout.delivery-confirmation:P3D}") Duration deliveryConfirmationTimeout,
                          @Value("${escrow.timeout.payment-processing:PT15M}") Duration paymentProcessingTimeout,
                          @Value("${escrow.timeout.dispute-sla:P2D}") Duration disputeSla,
                          @Value("${escrow.timeout.policy:AUTO_RELEASE}") TimeoutPolicy policy,
                          @Value("${escrow.sweeper.batch-size:100}") int batchSize) {
        this.transactionService = transactionService;
        this.disputeResolver = disputeResolver;
        this.actions = actions;
        this.metrics = metrics;
        this.clock = clock;
        this.deliveryConfirmationTimeout = deliveryConfirmationTimeout;
        this.paymentProcessingTimeout = paymentProcessingTimeout;
        this.disputeSla = disputeSla;
        this.policy = policy;
        this.batchSize = batchSize;
    }

    /**
     * Report of the most recent completed pass on this node, if any.
     */
    public Optional<SweepReport> lastReport() {
        return Optional.ofNullable(lastReport.get());
    }

    public SweepReport sweep() {
        return sweep(clock.instant());
    }

    /**
     * Runs one pass using {@code now} as the reference time for every cutoff.
     */
    public SweepReport sweep(Instant now) {
        return metrics.timeSweep(() -> doSweep(now));
    }

    private SweepReport doSweep(Instant now) {
        boolean ownsCorrelationId = !CorrelationContext.hasCorrelationId();
        if (ownsCorrelationId) {
            CorrelationContext.setCorrelationId("sweeper-" + CorrelationContext.generateCorrelationId());
            MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, CorrelationContext.getCorrelationId());
        }
        try {
            Tally tally = new Tally();

            List<UUID> overdue = transactionService.findOverdueEscrow(
                now.minus(deliveryConfirmationTimeout), batchSize, queryDeadline());
            for (UUID id : overdue) {
                if (policy == TimeoutPolicy.AUTO_REFUND) {
                    run("refund", id, actions::refund, tally, () -> tally.refunded++);
                } else {
                    run("auto_release", id, actions::autoRelease, tally, () -> tally.released++);
                }
            }

            List<UUID> stuck = transactionService.findStuckPayments(
                now.minus(paymentProcessingTimeout), batchSize, queryDeadline());
            for (UUID id : stuck) {
                run("cancel_stuck_payment", id, actions::cancelStuckPayment, tally, () -> tally.canceled++);
            }

            List<UUID> dueDisputes = disputeResolver.findDueForEscalation(
                now.minus(disputeSla), batchSize, queryDeadline());
            for (UUID id : dueDisputes) {
                run("escalate", id, disputeId -> {
                    if (!actions.escalate(disputeId)) {
                        throw new InvalidStateTransitionException("Dispute " + disputeId + " no longer needs escalation");
                    }
                }, tally, () -> tally.escalated++);
            }

            SweepReport report = tally.toReport(now);
            lastReport.set(report);
            if (report.total() > 0 || report.getFailed() > 0) {
                log.info("Sweep done: released={}, refunded={}, canceled={}, escalated={}, skipped={}, failed={}",
                    report.getReleased(), report.getRefunded(), report.getCanceled(), report.getEscalated(),
                    report.getSkipped(), report.getFailed());
            } else {
                log.debug("Sweep done, nothing due");
            }
            return report;
        } finally {
            if (ownsCorrelationId) {
                CorrelationContext.clear();
                MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            }
        }
    }

    private void run(String action, UUID id, Consumer<UUID> call, Tally tally, Runnable onSuccess) {
        try {
            call.accept(id);
            onSuccess.run();
            metrics.recordSweeperAction(action);
        } catch (InvalidStateTransitionException | HoldNotActiveException e) {
            // A user or another sweeper got there between the query and the lock
            tally.skipped++;
            metrics.recordSweeperAction(action + "_skipped");
            log.info("Sweeper {} skipped {}: {}", action, id, e.getMessage());
        } catch (RuntimeException e) {
            tally.failed++;
            metrics.recordSweeperAction(action + "_failed");
            log.error("Sweeper {} failed for {}, will retry next pass", action, id, e);
        }
    }

    private Deadline queryDeadline() {
        return Deadline.after(Duration.ofSeconds(30), clock);
    }

    private static final class Tally {
        int released;
        int refunded;
        int canceled;
        int escalated;
        int skipped;
        int failed;

        SweepReport toReport(Instant startedAt) {
            return new SweepReport(startedAt, released, refunded, canceled, escalated, skipped, failed);
        }
    }
}
