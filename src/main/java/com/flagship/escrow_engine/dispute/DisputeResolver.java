package com.flagship.escrow_engine.dispute;

import com.flagship.escrow_engine.error.AlreadyDisputedException;
import com.flagship.escrow_engine.error.AlreadyResolvedException;
import com.flagship.escrow_engine.error.EscrowException;
import com.flagship.escrow_engine.error.ForbiddenException;
import com.flagship.escrow_engine.error.InvalidAmountException;
import com.flagship.escrow_engine.error.InvalidStateTransitionException;
import com.flagship.escrow_engine.error.NotFoundException;
import com.flagship.escrow_engine.event.DisputeEscalatedEvent;
import com.flagship.escrow_engine.event.DisputeOpenedEvent;
import com.flagship.escrow_engine.event.DisputeResolvedEvent;
import com.flagship.escrow_engine.event.EscrowEventPublisher;
import com.flagship.escrow_engine.hold.Hold;
import com.flagship.escrow_engine.hold.HoldManager;
import com.flagship.escrow_engine.idempotency.IdempotencyService;
import com.flagship.escrow_engine.ledger.LedgerStore;
import com.flagship.escrow_engine.ledger.Wallet;
import com.flagship.escrow_engine.ledger.WalletKind;
import com.flagship.escrow_engine.observability.CorrelationContext;
import com.flagship.escrow_engine.observability.EscrowMetrics;
import com.flagship.escrow_engine.persistence.Deadline;
import com.flagship.escrow_engine.persistence.TransactionRunner;
import com.flagship.escrow_engine.transaction.Actor;
import com.flagship.escrow_engine.transaction.ActorRole;
import com.flagship.escrow_engine.transaction.EscrowTransaction;
import com.flagship.escrow_engine.transaction.EscrowTransactionRepository;
import com.flagship.escrow_engine.transaction.FeePolicy;
import com.flagship.escrow_engine.transaction.OperationResult;
import com.flagship.escrow_engine.transaction.TransactionStateMachine;
import com.flagship.escrow_engine.transaction.TransactionStatus;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Dispute lifecycle: opening, moderator resolution, and SLA escalation.
 *
 * Resolution forces the sale into a terminal RESOLVED_* state and moves the held
 * funds accordingly, always through {@link HoldManager}; this class never writes a
 * wallet row. Every call locks the sale's row first, the same serialization point
 * the transaction operations use, so a dispute can never race a delivery confirmation.
 */
@Service
@Slf4j
public class DisputeResolver {

    static final String OP_OPEN = "open_dispute";
    static final String OP_RESOLVE = "resolve_dispute";

    private final TransactionRunner transactionRunner;
    private final TransactionStateMachine stateMachine;
    private final DisputeRepository repository;
    private final EscrowTransactionRepository transactionRepository;
    private final HoldManager holdManager;
    private final LedgerStore ledgerStore;
    private final EscrowEventPublisher eventPublisher;
    private final IdempotencyService idempotencyService;
    private final EscrowMetrics metrics;
    private final Clock clock;
    private final Duration holdTtl;

    public DisputeResolver(TransactionRunner transactionRunner,
                           TransactionStateMachine stateMachine,
                           DisputeRepository repository,
                           EscrowTransactionRepository transactionRepository,
                           HoldManager holdManager,
                           LedgerStore ledgerStore,
                           EscrowEventPublisher eventPublisher,
                           IdempotencyService idempotencyService,
                           EscrowMetrics metrics,
                           Clock clock,
                           @org.springframework.beans.factory.annotation.Value("${escrow.hold.ttl:P7D}") Duration holdTtl) {
        this.transactionRunner = transactionRunner;
        this.stateMachine = stateMachine;
        this.repository = repository;
        this.transactionRepository = transactionRepository;
        this.holdManager = holdManager;
        this.ledgerStore = ledgerStore;
        this.eventPublisher = eventPublisher;
        this.idempotencyService = idempotencyService;
        this.metrics = metrics;
        this.clock = clock;
        this.holdTtl = holdTtl;
    }

    /**
     * Opens the sale's one dispute and moves it to DISPUTED.
     * The buyer or the seller may open it, from PAYMENT_PROCESSING or ESCROW_HELD.
     */
    public OperationResult<Dispute> open(UUID transactionId, Actor opener, String reason, List<String> evidenceRefs,
                                         String idempotencyKey, Deadline deadline) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("A dispute needs a reason");
        }
        String fingerprint = "txn=" + transactionId + "|opener=" + opener.getId();

        try (MDC.MDCCloseable ignored = CorrelationContext.withId(CorrelationContext.TRANSACTION_ID_MDC_KEY, transactionId)) {
            return transactionRunner.inTransaction(deadline, () -> {
                EscrowTransaction txn = stateMachine.lock(transactionId);
                if (idempotencyKey != null) {
                    Optional<Dispute> replay = idempotencyService.find(idempotencyKey, OP_OPEN, fingerprint)
                        .map(record -> load(record.getDisputeId()));
                    if (replay.isPresent()) {
                        return OperationResult.replayed(replay.get());
                    }
                }
                if (opener.getRole() != ActorRole.USER || !txn.isParty(opener.getId())) {
                    throw new ForbiddenException("Only the buyer or the seller may open a dispute");
                }
                if (txn.getDisputeId() != null || repository.findByTransactionId(transactionId).isPresent()) {
                    throw new AlreadyDisputedException("Transaction " + transactionId + " already has a dispute");
                }
                if (txn.getStatus() != TransactionStatus.PAYMENT_PROCESSING
                        && txn.getStatus() != TransactionStatus.ESCROW_HELD) {
                    throw new InvalidStateTransitionException(txn.getStatus(), TransactionStatus.DISPUTED);
                }

                Instant now = clock.instant();
                DisputeEntity entity = repository.save(DisputeEntity.open(
                    transactionId, opener.getId(), reason, evidenceRefs != null ? evidenceRefs : List.of(), now));
                stateMachine.transition(txn.toBuilder().disputeId(entity.getId()).build(),
                    TransactionStatus.DISPUTED, opener, "dispute opened: " + reason);

                // Funds stay held for as long as the dispute takes
                holdManager.findActiveByTransaction(transactionId)
                    .ifPresent(hold -> holdManager.extendHold(hold.getId(), now.plus(holdTtl)));

                Dispute dispute = entity.toDomain();
                eventPublisher.publish(DisputeOpenedEvent.fromDispute(dispute));
                if (idempotencyKey != null) {
                    idempotencyService.save(idempotencyKey, OP_OPEN, fingerprint, transactionId, null, dispute.getId());
                }
                metrics.recordDispute("opened");
                log.info("Dispute {} opened on transaction {} by {}", dispute.getId(), transactionId, opener.getId());
                return OperationResult.executed(dispute);
            });
        } catch (EscrowException e) {
            metrics.recordRejected(OP_OPEN, e.getCode().name());
            throw e;
        }
    }

    /**
     * Decides a dispute. Moderators only.
     *
     * @param splitRatio share of the amount returned to the buyer, required for SPLIT and in (0, 1)
     */
    public OperationResult<Resolution> resolve(UUID disputeId, Actor resolver, DisputeOutcome outcome,
                                               BigDecimal splitRatio, String note,
                                               String idempotencyKey, Deadline deadline) {
        if (!resolver.isModerator()) {
            throw new ForbiddenException("Only a moderator may resolve a dispute");
        }
        String fingerprint = "dispute=" + disputeId + "|outcome=" + outcome
            + (splitRatio != null ? "|ratio=" + splitRatio.stripTrailingZeros().toPlainString() : "");

        try (MDC.MDCCloseable ignored = CorrelationContext.withId(CorrelationContext.DISPUTE_ID_MDC_KEY, disputeId)) {
            return transactionRunner.inTransaction(deadline, () -> {
                UUID transactionId = repository.findById(disputeId)
                    .map(DisputeEntity::getTransactionId)
                    .orElseThrow(() -> NotFoundException.of("Dispute", disputeId));
                EscrowTransaction txn = stateMachine.lock(transactionId);
                DisputeEntity entity = repository.findByIdForUpdate(disputeId)
                    .orElseThrow(() -> NotFoundException.of("Dispute", disputeId));

                if (idempotencyKey != null
                        && idempotencyService.find(idempotencyKey, OP_RESOLVE, fingerprint).isPresent()) {
                    return OperationResult.replayed(new Resolution(entity.toDomain(), txn));
                }
                if (entity.getStatus().isResolved()) {
                    throw new AlreadyResolvedException("Dispute " + disputeId + " is already " + entity.getStatus());
                }

                Resolution resolution = settle(entity, txn, resolver, outcome, splitRatio, note);
                if (idempotencyKey != null) {
                    idempotencyService.save(idempotencyKey, OP_RESOLVE, fingerprint, transactionId, null, disputeId);
                }
                return OperationResult.executed(resolution);
            });
        } catch (EscrowException e) {
            metrics.recordRejected(OP_RESOLVE, e.getCode().name());
            throw e;
        }
    }

    public Dispute get(UUID disputeId, Actor actor, Deadline deadline) {
        return transactionRunner.readOnly(deadline, () -> {
            DisputeEntity entity = repository.findById(disputeId)
                .orElseThrow(() -> NotFoundException.of("Dispute", disputeId));
            if (actor.getRole() == ActorRole.USER) {
                boolean party = transactionRepository.findById(entity.getTransactionId())
                    .map(txn -> txn.toDomain().isParty(actor.getId()))
                    .orElse(false);
                if (!party) {
                    throw NotFoundException.of("Dispute", disputeId);
                }
            }
            return entity.toDomain();
        });
    }

    /**
     * Open disputes past their SLA that have not been escalated yet, oldest first.
     */
    public List<UUID> findDueForEscalation(Instant cutoff, int limit, Deadline deadline) {
        return transactionRunner.readOnly(deadline,
            () -> repository.findDueForEscalation(cutoff, PageRequest.of(0, limit)));
    }

    /**
     * Flags an open dispute for the moderation queue. At most once per dispute;
     * never touches the funds.
     *
     * @return true if this call escalated it
     */
    public boolean escalate(UUID disputeId, Deadline deadline) {
        try (MDC.MDCCloseable ignored = CorrelationContext.withId(CorrelationContext.DISPUTE_ID_MDC_KEY, disputeId)) {
            return transactionRunner.inTransaction(deadline, () -> {
                DisputeEntity entity = repository.findByIdForUpdate(disputeId)
                    .orElseThrow(() -> NotFoundException.of("Dispute", disputeId));
                if (!entity.markEscalated(clock.instant())) {
                    return false;
                }
                repository.save(entity);
                eventPublisher.publish(DisputeEscalatedEvent.fromDispute(entity.toDomain()));
                metrics.recordDispute("escalated");
                log.warn("Dispute {} on transaction {} passed its SLA, escalated to moderation",
                    disputeId, entity.getTransactionId());
                return true;
            });
        }
    }

    private Resolution settle(DisputeEntity entity, EscrowTransaction txn, Actor resolver,
                              DisputeOutcome outcome, BigDecimal splitRatio, String note) {
        Optional<Hold> hold = holdManager.findActiveByTransaction(txn.getId());
        if (hold.isEmpty() && outcome != DisputeOutcome.BUYER) {
            // Dispute opened while the payment was still in flight: nothing to pay out
            throw new InvalidStateTransitionException(
                "No funds are held for transaction " + txn.getId() + "; only a buyer outcome is possible");
        }

        long amount = txn.getAmount();
        long buyerAmount;
        long sellerAmount;
        long feeAmount;
        BigDecimal ratio = null;

        switch (outcome) {
            case BUYER -> {
                hold.ifPresent(h -> holdManager.releaseHold(h.getId(), BigDecimal.ONE));
                buyerAmount = hold.map(Hold::getAmount).orElse(0L);
                sellerAmount = 0;
                feeAmount = 0;
            }
            case SELLER -> {
                feeAmount = txn.getFeeAmount();
                holdManager.captureHold(hold.get().getId(), sellerWallet(txn).getId(), feeAmount);
                buyerAmount = 0;
                sellerAmount = amount - feeAmount;
            }
            case SPLIT -> {
                ratio = requireSplitRatio(splitRatio);
                buyerAmount = buyerShare(amount, ratio);
                long sellerShare = amount - buyerAmount;
                feeAmount = FeePolicy.proportionalFee(txn.getFeeAmount(), sellerShare, amount);
                sellerAmount = sellerShare - feeAmount;
                Hold released = holdManager.releaseHold(hold.get().getId(), ratio);
                if (released.getReleasedAmount() != buyerAmount) {
                    throw new IllegalStateException("Released " + released.getReleasedAmount()
                        + " but the buyer's share is " + buyerAmount);
                }
                holdManager.captureHold(hold.get().getId(), sellerWallet(txn).getId(), feeAmount);
            }
            default -> throw new IllegalArgumentException("Unknown outcome " + outcome);
        }

        Instant now = clock.instant();
        entity.resolve(outcome, ratio, buyerAmount, sellerAmount, feeAmount, note, resolver.getId(), now);
        repository.save(entity);
        EscrowTransaction resolved = stateMachine.transition(txn, outcome.getTransactionStatus(), resolver,
            "dispute resolved: " + outcome.name().toLowerCase());

        Dispute dispute = entity.toDomain();
        eventPublisher.publish(DisputeResolvedEvent.fromDispute(dispute));
        metrics.recordDispute("resolved_" + outcome.name().toLowerCase());
        log.info("Dispute {} resolved {} by {}: buyer={}, seller={}, fee={}",
            dispute.getId(), outcome, resolver.getId(), buyerAmount, sellerAmount, feeAmount);
        return new Resolution(dispute, resolved);
    }

    private Wallet sellerWallet(EscrowTransaction txn) {
        return ledgerStore.getOrCreateWallet(txn.getSellerId(), txn.getCurrency(), WalletKind.USER);
    }

    private static BigDecimal requireSplitRatio(BigDecimal splitRatio) {
        if (splitRatio == null || splitRatio.signum() <= 0 || splitRatio.compareTo(BigDecimal.ONE) >= 0) {
            throw new InvalidAmountException("Split ratio must be strictly between 0 and 1, got " + splitRatio);
        }
        return splitRatio;
    }

    /**
     * Buyer's part of a split, rounded half-up. Both sides must end up with something.
     */
    static long buyerShare(long amount, BigDecimal ratio) {
        long share = BigDecimal.valueOf(amount).multiply(ratio).setScale(0, RoundingMode.HALF_UP).longValueExact();
        if (share < 1 || share > amount - 1) {
            throw new InvalidAmountException(
                String.format("Split ratio %s of %d leaves one side with nothing", ratio.toPlainString(), amount));
        }
        return share;
    }

    private Dispute load(UUID disputeId) {
        return repository.findById(disputeId)
            .map(DisputeEntity::toDomain)
            .orElseThrow(() -> NotFoundException.of("Dispute", disputeId));
    }

    /**
     * A resolved dispute together with the sale in its terminal state.
     */
    @Value
    public static class Resolution {
        Dispute dispute;
        EscrowTransaction transaction;
    }
}
