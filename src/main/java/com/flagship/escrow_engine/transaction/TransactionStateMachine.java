package com.flagship.escrow_engine.transaction;

import com.flagship.escrow_engine.error.InvalidStateTransitionException;
import com.flagship.escrow_engine.error.NotFoundException;
import com.flagship.escrow_engine.event.EscrowEventPublisher;
import com.flagship.escrow_engine.event.TransactionStatusChangedEvent;
import com.flagship.escrow_engine.observability.EscrowMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * The only writer of transaction status.
 *
 * Every transition, whether user-driven, moderator-driven or forced by the sweeper:
 * 1. Runs under the transaction's row lock, so transitions on one sale are serialized
 * 2. Is checked against {@link TransactionStatus}'s table
 * 3. Appends one history line and queues one status_changed event, in the same commit
 */
@Component
@RequiredArgsConstructor
@Slf4j
@Transactional(propagation = Propagation.MANDATORY)
public class TransactionStateMachine {

    private final EscrowTransactionRepository repository;
    private final TransactionHistoryRepository historyRepository;
    private final EscrowEventPublisher eventPublisher;
    private final EscrowMetrics metrics;
    private final Clock clock;

    /**
     * Persists a new PENDING sale and records its creation.
     */
    public EscrowTransaction create(EscrowTransaction txn, String idempotencyKey, Actor actor) {
        EscrowTransactionEntity saved = repository.saveAndFlush(EscrowTransactionEntity.fromDomain(txn, idempotencyKey));
        EscrowTransaction created = saved.toDomain();

        record(null, created, actor, "created", created.getCreatedAt());
        metrics.recordTransactionCreated(created.getCurrency().name());
        log.info("Transaction {} created: buyer={}, seller={}, amount={} {}, fee={}",
            created.getId(), created.getBuyerId(), created.getSellerId(),
            created.getAmount(), created.getCurrency(), created.getFeeAmount());
        return created;
    }

    /**
     * Loads the sale and holds its row lock until the surrounding transaction ends.
     */
    public EscrowTransaction lock(UUID transactionId) {
        return lockEntity(transactionId).toDomain();
    }

    /**
     * Moves the sale to {@code target}.
     *
     * {@code updated} may carry field changes that belong to this step (payment wallet,
     * dispute reference); its status is ignored in favour of the locked row's.
     *
     * @throws InvalidStateTransitionException if the table does not allow the move
     */
    public EscrowTransaction transition(EscrowTransaction updated, TransactionStatus target,
                                        Actor actor, String reason) {
        EscrowTransactionEntity entity = lockEntity(updated.getId());
        TransactionStatus from = entity.getStatus();
        if (!from.canTransitionTo(target)) {
            metrics.recordRejected("transition", "INVALID_STATE_TRANSITION");
            log.warn("Transaction {} rejected {} -> {} by {} {}", updated.getId(), from, target,
                actor.getRole(), actor.getId());
            throw new InvalidStateTransitionException(from, target);
        }

        Instant now = clock.instant();
        EscrowTransaction next = updated.toBuilder().status(from).build().withStatus(target, now);
        entity.updateFromDomain(next);
        EscrowTransaction saved = repository.saveAndFlush(entity).toDomain();

        record(from, saved, actor, reason, now);
        metrics.recordTransition(from.name(), target.name(), actor.getRole().name());
        log.info("Transaction {} {} -> {} by {} {} ({})", saved.getId(), from, target,
            actor.getRole(), actor.getId(), reason);
        return saved;
    }

    private EscrowTransactionEntity lockEntity(UUID transactionId) {
        return repository.findByIdForUpdate(transactionId)
            .orElseThrow(() -> NotFoundException.of("Transaction", transactionId));
    }

    private void record(TransactionStatus from, EscrowTransaction txn, Actor actor, String reason, Instant at) {
        historyRepository.save(TransactionHistoryEntity.record(txn.getId(), from, txn.getStatus(), actor, reason, at));
        eventPublisher.publish(TransactionStatusChangedEvent.of(txn, from, actor, reason, at));
    }
}
