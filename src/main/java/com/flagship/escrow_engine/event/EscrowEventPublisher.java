package com.flagship.escrow_engine.event;

import com.flagship.escrow_engine.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Emits lifecycle events by writing them to the outbox in the current transaction.
 *
 * Fire-and-forget from the engine's point of view: the event commits with the
 * transition and is relayed later, so a broker outage never fails an engine call.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EscrowEventPublisher {

    private final OutboxService outboxService;

    @Transactional(propagation = Propagation.MANDATORY)
    public void publish(EscrowEvent event) {
        outboxService.saveEvent(event.getAggregateType(), event.getTransactionId(), event.getEventType(), event);
        log.debug("Queued {} for transaction {}", event.getEventType(), event.getTransactionId());
    }
}
