package com.flagship.escrow_engine.observability;

import com.flagship.escrow_engine.AbstractIntegrationTest;
import com.flagship.escrow_engine.ledger.CurrencyCode;
import com.flagship.escrow_engine.transaction.Actor;
import com.flagship.escrow_engine.transaction.EscrowTransactionService;
import com.flagship.escrow_engine.transaction.TransactionStatus;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetricsSchedulerTest extends AbstractIntegrationTest {

    @Autowired
    private MetricsScheduler metricsScheduler;

    @Autowired
    private EscrowMetrics escrowMetrics;

    @Autowired
    private EscrowTransactionService transactionService;

    @Autowired
    private OutboxMetrics outboxMetrics;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    void statusGaugesCountStoredSales() {
        UUID buyerId = UUID.randomUUID();
        transactionService.create(buyerId, UUID.randomUUID(), "listing-gauge", 1_500,
            CurrencyCode.USD, Actor.user(buyerId), null, deadline());

        metricsScheduler.refreshStatusGauges();

        assertTrue(escrowMetrics.statusCount(TransactionStatus.PENDING) >= 1);
        assertNotNull(meterRegistry.find("escrow.transactions.in_status")
            .tag("status", "PENDING").gauge());
    }

    @Test
    void outboxGaugesAreRegistered() {
        metricsScheduler.refreshOutboxMetrics();

        assertNotNull(meterRegistry.find("outbox.backlog.size").gauge());
        assertNotNull(meterRegistry.find("outbox.backlog.by_aggregate").tag("aggregate", "Dispute").gauge());
        assertNotNull(meterRegistry.find("outbox.events.failed").gauge());
        assertEquals(0, outboxMetrics.getBacklogSize("Wallet"));
    }
}
