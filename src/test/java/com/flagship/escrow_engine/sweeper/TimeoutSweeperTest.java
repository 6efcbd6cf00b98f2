package com.flagship.escrow_engine.sweeper;

import com.flagship.escrow_engine.dispute.DisputeResolver;
import com.flagship.escrow_engine.error.HoldNotActiveException;
import com.flagship.escrow_engine.error.InvalidStateTransitionException;
import com.flagship.escrow_engine.error.StoreUnavailableException;
import com.flagship.escrow_engine.observability.CorrelationContext;
import com.flagship.escrow_engine.observability.EscrowMetrics;
import com.flagship.escrow_engine.observability.HealthIndicators;
import com.flagship.escrow_engine.transaction.EscrowTransactionService;
import com.flagship.escrow_engine.transaction.TransactionStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TimeoutSweeperTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    @Mock
    private EscrowTransactionService transactionService;

    @Mock
    private DisputeResolver disputeResolver;

    @Mock
    private SweeperActions actions;

    private SimpleMeterRegistry registry;
    private Clock clock;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        lenient().when(transactionService.findOverdueEscrow(any(), anyInt(), any())).thenReturn(List.of());
        lenient().when(transactionService.findStuckPayments(any(), anyInt(), any())).thenReturn(List.of());
        lenient().when(disputeResolver.findDueForEscalation(any(), anyInt(), any())).thenReturn(List.of());
    }

    @Test
    @DisplayName("Health is unknown before the first pass and up after a clean one")
    void reportsLastPassToHealth() {
        TimeoutSweeper sweeper = sweeper(TimeoutPolicy.AUTO_RELEASE);
        HealthIndicators.SweeperHealthIndicator indicator = new HealthIndicators.SweeperHealthIndicator(sweeper);
        assertTrue(sweeper.lastReport().isEmpty());
        assertEquals(Status.UNKNOWN, indicator.health().getStatus());

        sweeper.sweep(NOW);

        assertEquals(NOW, sweeper.lastReport().orElseThrow().getStartedAt());
        assertEquals(Status.UP, indicator.health().getStatus());
        assertEquals(NOW.toString(), indicator.health().getDetails().get("lastSweepAt"));
    }

    @Test
    @DisplayName("Cutoffs are derived from the pass time and the configured timeouts")
    void usesConfiguredCutoffs() {
        sweeper(TimeoutPolicy.AUTO_RELEASE).sweep(NOW);

        verify(transactionService).findOverdueEscrow(eq(NOW.minus(Duration.ofDays(3))), eq(50), any());
        verify(transactionService).findStuckPayments(eq(NOW.minus(Duration.ofMinutes(15))), eq(50), any());
        verify(disputeResolver).findDueForEscalation(eq(NOW.minus(Duration.ofDays(2))), eq(50), any());
    }

    @Test
    @DisplayName("AUTO_RELEASE policy confirms overdue escrow for the seller")
    void autoReleasePolicy() {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        when(transactionService.findOverdueEscrow(any(), anyInt(), any())).thenReturn(List.of(first, second));

        SweepReport report = sweeper(TimeoutPolicy.AUTO_RELEASE).sweep(NOW);

        verify(actions).autoRelease(first);
        verify(actions).autoRelease(second);
        verify(actions, never()).refund(any());
        assertEquals(2, report.getReleased());
        assertEquals(0, report.getRefunded());
    }

    @Test
    @DisplayName("AUTO_REFUND policy returns overdue escrow to the buyer")
    void autoRefundPolicy() {
        UUID id = UUID.randomUUID();
        when(transactionService.findOverdueEscrow(any(), anyInt(), any())).thenReturn(List.of(id));

        SweepReport report = sweeper(TimeoutPolicy.AUTO_REFUND).sweep(NOW);

        verify(actions).refund(id);
        verify(actions, never()).autoRelease(any());
        assertEquals(1, report.getRefunded());
    }

    @Test
    @DisplayName("Lost races are skipped, failures are counted, and neither stops the pass")
    void oneBadItemDoesNotStopThePass() {
        UUID raced = UUID.randomUUID();
        UUID broken = UUID.randomUUID();
        UUID fine = UUID.randomUUID();
        UUID alreadyResolved = UUID.randomUUID();
        when(transactionService.findOverdueEscrow(any(), anyInt(), any())).thenReturn(List.of(raced, broken, fine));
        doThrow(new InvalidStateTransitionException(TransactionStatus.DISPUTED, TransactionStatus.COMPLETED))
            .when(actions).autoRelease(raced);
        doThrow(new StoreUnavailableException("database unreachable", null))
            .when(actions).autoRelease(broken);
        when(transactionService.findStuckPayments(any(), anyInt(), any())).thenReturn(List.of(alreadyResolved));
        doThrow(new HoldNotActiveException("hold already resolved"))
            .when(actions).cancelStuckPayment(alreadyResolved);

        TimeoutSweeper sweeper = sweeper(TimeoutPolicy.AUTO_RELEASE);
        SweepReport report = sweeper.sweep(NOW);

        verify(actions).autoRelease(fine);
        assertEquals(1, report.getReleased());
        assertEquals(2, report.getSkipped());
        assertEquals(1, report.getFailed());
        assertEquals(1.0, registry.get("escrow.sweeper.actions").tag("action", "auto_release_failed").counter().count());

        Health health = new HealthIndicators.SweeperHealthIndicator(sweeper).health();
        assertEquals("WARNING", health.getStatus().getCode());
        assertEquals(1, health.getDetails().get("failed"));
    }

    @Test
    @DisplayName("Disputes are escalated only; an already escalated one counts as skipped")
    void escalatesDisputes() {
        UUID due = UUID.randomUUID();
        UUID already = UUID.randomUUID();
        when(disputeResolver.findDueForEscalation(any(), anyInt(), any())).thenReturn(List.of(due, already));
        when(actions.escalate(due)).thenReturn(true);
        when(actions.escalate(already)).thenReturn(false);

        SweepReport report = sweeper(TimeoutPolicy.AUTO_RELEASE).sweep(NOW);

        assertEquals(1, report.getEscalated());
        assertEquals(1, report.getSkipped());
        verify(disputeResolver, never()).resolve(any(), any(), any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("A pass gets its own correlation id and leaves the caller's alone")
    void correlationId() {
        doAnswer(invocation -> {
            assertTrue(CorrelationContext.getCorrelationId().startsWith("sweeper-"));
            return null;
        }).when(actions).cancelStuckPayment(any());
        when(transactionService.findStuckPayments(any(), anyInt(), any())).thenReturn(List.of(UUID.randomUUID()));

        sweeper(TimeoutPolicy.AUTO_RELEASE).sweep(NOW);
        assertFalse(CorrelationContext.hasCorrelationId());

        CorrelationContext.setCorrelationId("outer");
        try {
            sweeper(TimeoutPolicy.AUTO_RELEASE).sweep(NOW);
            assertEquals("outer", CorrelationContext.getCorrelationId());
        } finally {
            CorrelationContext.clear();
        }
    }

    private TimeoutSweeper sweeper(TimeoutPolicy policy) {
        return new TimeoutSweeper(transactionService, disputeResolver, actions, new EscrowMetrics(registry), clock,
            Duration.ofDays(3), Duration.ofMinutes(15), Duration.ofDays(2), policy, 50);
    }
}
