package com.flagship.escrow_engine.transaction;

import com.flagship.escrow_engine.error.CurrencyMismatchException;
import com.flagship.escrow_engine.error.DeadlineExceededException;
import com.flagship.escrow_engine.error.EscrowException;
import com.flagship.escrow_engine.error.ForbiddenException;
import com.flagship.escrow_engine.error.IdempotencyConflictException;
import com.flagship.escrow_engine.error.InvalidStateTransitionException;
import com.flagship.escrow_engine.error.NotFoundException;
import com.flagship.escrow_engine.hold.Hold;
import com.flagship.escrow_engine.hold.HoldManager;
import com.flagship.escrow_engine.idempotency.IdempotencyRecord;
import com.flagship.escrow_engine.idempotency.IdempotencyService;
import com.flagship.escrow_engine.ledger.CurrencyCode;
import com.flagship.escrow_engine.ledger.LedgerStore;
import com.flagship.escrow_engine.ledger.Wallet;
import com.flagship.escrow_engine.ledger.WalletKind;
import com.flagship.escrow_engine.observability.CorrelationContext;
import com.flagship.escrow_engine.observability.EscrowMetrics;
import com.flagship.escrow_engine.persistence.Deadline;
import com.flagship.escrow_engine.persistence.TransactionRunner;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Public operations on a sale: create, pay, confirm delivery, cancel, and the reads.
 *
 * Each call is one or more {@link TransactionRunner} units bounded by the caller's
 * {@link Deadline}. Status changes go through {@link TransactionStateMachine};
 * money moves go through {@link HoldManager}.
 */
@Service
@Slf4j
public class EscrowTransactionService {

    static final String OP_CREATE = "create_transaction";
    static final String OP_PAY = "initiate_payment";
    static final String OP_CONFIRM = "confirm_delivery";
    static final String OP_CANCEL = "cancel_transaction";

    private final TransactionRunner transactionRunner;
    private final TransactionStateMachine stateMachine;
    private final EscrowTransactionRepository repository;
    private final TransactionHistoryRepository historyRepository;
    private final HoldManager holdManager;
    private final LedgerStore ledgerStore;
    private final IdempotencyService idempotencyService;
    private final FeePolicy feePolicy;
    private final EscrowMetrics metrics;
    private final Clock clock;
    private final Duration holdTtl;

    public EscrowTransactionService(TransactionRunner transactionRunner,
                                    TransactionStateMachine stateMachine,
                                    EscrowTransactionRepository repository,
                                    TransactionHistoryRepository historyRepository,
                                    HoldManager holdManager,
                                    LedgerStore ledgerStore,
                                    IdempotencyService idempotencyService,
                                    FeePolicy feePolicy,
                                    EscrowMetrics metrics,
                                    Clock clock,
                                    @Value("${escrow.hold.ttl:P7D}") Duration holdTtl) {
        this.transactionRunner = transactionRunner;
        this.stateMachine = stateMachine;
        this.repository = repository;
        this.historyRepository = historyRepository;
        this.holdManager = holdManager;
        this.ledgerStore = ledgerStore;
        this.idempotencyService = idempotencyService;
        this.feePolicy = feePolicy;
        this.metrics = metrics;
        this.clock = clock;
        this.holdTtl = holdTtl;
    }

    /**
     * Creates a PENDING sale. With an idempotency key, a retry returns the sale the
     * first call created.
     */
    public OperationResult<EscrowTransaction> create(UUID buyerId, UUID sellerId, String listingRef,
                                                     long amount, CurrencyCode currency,
                                                     Actor actor, String idempotencyKey, Deadline deadline) {
        Objects.requireNonNull(currency, "currency");
        if (actor.getRole() == ActorRole.USER && !actor.is(buyerId) && !actor.is(sellerId)) {
            throw new ForbiddenException("Only a party to the sale may create it");
        }
        EscrowTransaction draft = EscrowTransaction.create(listingRef, buyerId, sellerId, amount, currency,
            feePolicy.feeFor(amount), clock.instant());

        if (idempotencyKey != null) {
            Optional<EscrowTransaction> existing = findCreatedWithKey(idempotencyKey, draft, deadline);
            if (existing.isPresent()) {
                return OperationResult.replayed(existing.get());
            }
        }

        try {
            return OperationResult.executed(transactionRunner.inTransaction(deadline,
                () -> stateMachine.create(draft, idempotencyKey, actor)));
        } catch (DataIntegrityViolationException e) {
            // Concurrent create with the same key won the unique constraint
            return findCreatedWithKey(idempotencyKey, draft, deadline)
                .map(OperationResult::replayed)
                .orElseThrow(() -> e);
        }
    }

    /**
     * Pays for a PENDING sale by placing an escrow hold on the buyer's wallet.
     *
     * Runs as two units: the sale is committed to PAYMENT_PROCESSING first, then the hold
     * is placed and the sale moved to ESCROW_HELD. If the hold cannot be funded the sale
     * goes back to PENDING so the buyer can pay with another wallet. A retry with the same
     * key replays a completed payment, or resumes one that stopped half way.
     */
    public OperationResult<PaymentResult> initiatePayment(UUID transactionId, UUID walletId, Actor actor,
                                                          String idempotencyKey, Deadline deadline) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key is required to initiate a payment");
        }
        String fingerprint = "txn=" + transactionId + "|wallet=" + walletId;
        Instant started = clock.instant();

        try (MDC.MDCCloseable ignored = CorrelationContext.withId(CorrelationContext.TRANSACTION_ID_MDC_KEY, transactionId)) {
            Optional<PaymentResult> replay = transactionRunner.inTransaction(deadline, () -> {
                EscrowTransaction txn = stateMachine.lock(transactionId);
                Optional<IdempotencyRecord> previous = idempotencyService.find(idempotencyKey, OP_PAY, fingerprint);
                if (previous.isPresent()) {
                    return Optional.of(replayPayment(txn, previous.get()));
                }
                startPayment(txn, walletId, actor, idempotencyKey);
                return Optional.empty();
            });
            if (replay.isPresent()) {
                metrics.recordOperationLatency(OP_PAY, Duration.between(started, clock.instant()));
                return OperationResult.replayed(replay.get());
            }

            try {
                OperationResult<PaymentResult> result = transactionRunner.inTransaction(deadline, () -> {
                    EscrowTransaction txn = stateMachine.lock(transactionId);
                    Optional<IdempotencyRecord> previous = idempotencyService.find(idempotencyKey, OP_PAY, fingerprint);
                    if (previous.isPresent()) {
                        return OperationResult.replayed(replayPayment(txn, previous.get()));
                    }
                    return OperationResult.executed(placeEscrowHold(txn, walletId, actor, idempotencyKey, fingerprint));
                });
                metrics.recordOperationLatency(OP_PAY, Duration.between(started, clock.instant()));
                return result;
            } catch (EscrowException e) {
                if (!e.getCode().isRetryable() && !(e instanceof DeadlineExceededException)) {
                    revertToPending(transactionId, idempotencyKey, actor, e);
                }
                metrics.recordRejected(OP_PAY, e.getCode().name());
                throw e;
            }
        }
    }

    /**
     * ESCROW_HELD -> COMPLETED: captures the hold to the seller minus the fee.
     * Only the buyer, or the system on timeout, may confirm.
     */
    public OperationResult<EscrowTransaction> confirmDelivery(UUID transactionId, Actor actor,
                                                              String idempotencyKey, Deadline deadline) {
        return keyed(OP_CONFIRM, transactionId, actor, idempotencyKey, deadline, txn -> {
            if (!actor.isSystem() && !(actor.getRole() == ActorRole.USER && txn.isBuyer(actor.getId()))) {
                throw new ForbiddenException("Only the buyer may confirm delivery");
            }
            if (txn.getStatus() != TransactionStatus.ESCROW_HELD) {
                throw new InvalidStateTransitionException(txn.getStatus(), TransactionStatus.COMPLETED);
            }
            Hold hold = activeHold(txn);
            Wallet payout = ledgerStore.getOrCreateWallet(txn.getSellerId(), txn.getCurrency(), WalletKind.USER);
            holdManager.captureHold(hold.getId(), payout.getId(), txn.getFeeAmount());
            return stateMachine.transition(txn, TransactionStatus.COMPLETED, actor,
                actor.isSystem() ? "delivery confirmation timed out, auto-released" : "delivery confirmed");
        });
    }

    /**
     * Cancels a sale before any money is held. Users may cancel only from PENDING;
     * the system may also cancel a payment that never completed, returning any stray hold.
     */
    public OperationResult<EscrowTransaction> cancel(UUID transactionId, Actor actor,
                                                     String idempotencyKey, Deadline deadline) {
        return keyed(OP_CANCEL, transactionId, actor, idempotencyKey, deadline, txn -> {
            if (!actor.isSystem() && !(actor.getRole() == ActorRole.USER && txn.isParty(actor.getId()))) {
                throw new ForbiddenException("Only a party to the sale may cancel it");
            }
            boolean stuckPayment = txn.getStatus() == TransactionStatus.PAYMENT_PROCESSING && actor.isSystem();
            if (txn.getStatus() != TransactionStatus.PENDING && !stuckPayment) {
                throw new InvalidStateTransitionException(txn.getStatus(), TransactionStatus.CANCELED);
            }
            if (stuckPayment) {
                holdManager.findActiveByTransaction(txn.getId())
                    .ifPresent(hold -> holdManager.expireHold(hold.getId()));
            }
            return stateMachine.transition(txn, TransactionStatus.CANCELED, actor,
                stuckPayment ? "payment processing timed out" : "canceled");
        });
    }

    /**
     * ESCROW_HELD -> REFUNDED on timeout: the hold expires back to the buyer.
     * System only; used when the timeout policy favours the buyer.
     */
    public EscrowTransaction refundOnTimeout(UUID transactionId, Deadline deadline) {
        Actor system = Actor.system();
        return keyed(null, transactionId, system, null, deadline, txn -> {
            if (txn.getStatus() != TransactionStatus.ESCROW_HELD || txn.getDisputeId() != null) {
                throw new InvalidStateTransitionException(txn.getStatus(), TransactionStatus.REFUNDED);
            }
            holdManager.expireHold(activeHold(txn).getId());
            return stateMachine.transition(txn, TransactionStatus.REFUNDED, system,
                "delivery confirmation timed out, refunded");
        }).getValue();
    }

    public EscrowTransaction get(UUID transactionId, Actor actor, Deadline deadline) {
        return transactionRunner.readOnly(deadline, () -> {
            EscrowTransaction txn = repository.findById(transactionId)
                .map(EscrowTransactionEntity::toDomain)
                .orElseThrow(() -> NotFoundException.of("Transaction", transactionId));
            if (!canSee(actor, txn)) {
                // Same answer as a missing sale, so ids cannot be probed
                throw NotFoundException.of("Transaction", transactionId);
            }
            return txn;
        });
    }

    public Page<EscrowTransaction> listByParty(UUID partyId, PartyRole role, TransactionStatus status,
                                               int page, int size, Actor actor, Deadline deadline) {
        if (actor.getRole() == ActorRole.USER && !actor.is(partyId)) {
            throw new ForbiddenException("Users may only list their own sales");
        }
        PageRequest pageRequest = PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "createdAt"));
        return transactionRunner.readOnly(deadline, () -> repository
            .findAll(TransactionQueries.forParty(partyId, role).and(TransactionQueries.withStatus(status)), pageRequest)
            .map(EscrowTransactionEntity::toDomain));
    }

    public List<TransactionHistoryEvent> history(UUID transactionId, Actor actor, Deadline deadline) {
        get(transactionId, actor, deadline);
        return transactionRunner.readOnly(deadline, () -> historyRepository.findByTransactionIdOrderByIdAsc(transactionId)
            .stream()
            .map(TransactionHistoryEntity::toDomain)
            .toList());
    }

    public List<Hold> holds(UUID transactionId, Actor actor, Deadline deadline) {
        get(transactionId, actor, deadline);
        return transactionRunner.readOnly(deadline, () -> holdManager.findByTransaction(transactionId));
    }

    /**
     * Sales in ESCROW_HELD since before {@code cutoff} with no dispute, oldest first.
     */
    public List<UUID> findOverdueEscrow(Instant cutoff, int limit, Deadline deadline) {
        return transactionRunner.readOnly(deadline, () -> repository.findHeldSince(cutoff, PageRequest.of(0, limit)));
    }

    /**
     * Sales stuck in PAYMENT_PROCESSING since before {@code cutoff}, oldest first.
     */
    public List<UUID> findStuckPayments(Instant cutoff, int limit, Deadline deadline) {
        return transactionRunner.readOnly(deadline, () -> repository.findPaymentStuckSince(cutoff, PageRequest.of(0, limit)));
    }

    private void startPayment(EscrowTransaction txn, UUID walletId, Actor actor, String idempotencyKey) {
        if (actor.getRole() != ActorRole.USER || !txn.isBuyer(actor.getId())) {
            throw new ForbiddenException("Only the buyer may pay for a sale");
        }
        if (txn.getStatus() == TransactionStatus.PAYMENT_PROCESSING) {
            if (!idempotencyKey.equals(txn.getPaymentAttemptKey())) {
                throw new InvalidStateTransitionException(txn.getStatus(), TransactionStatus.PAYMENT_PROCESSING);
            }
            if (!walletId.equals(txn.getPaymentWalletId())) {
                throw new IdempotencyConflictException("Idempotency key was already used with another wallet");
            }
            log.info("Resuming payment attempt {} for transaction {}", idempotencyKey, txn.getId());
            return;
        }
        if (txn.getStatus() != TransactionStatus.PENDING) {
            throw new InvalidStateTransitionException(txn.getStatus(), TransactionStatus.PAYMENT_PROCESSING);
        }

        Wallet wallet = ledgerStore.findWallet(walletId).orElseThrow(() -> NotFoundException.of("Wallet", walletId));
        if (!wallet.getOwnerId().equals(txn.getBuyerId())) {
            throw new ForbiddenException("Wallet " + walletId + " does not belong to the buyer");
        }
        if (wallet.getCurrency() != txn.getCurrency()) {
            throw new CurrencyMismatchException(String.format(
                "Sale is in %s, wallet is in %s", txn.getCurrency(), wallet.getCurrency()));
        }

        stateMachine.transition(
            txn.toBuilder().paymentWalletId(walletId).paymentAttemptKey(idempotencyKey).build(),
            TransactionStatus.PAYMENT_PROCESSING, actor, "payment initiated");
    }

    private PaymentResult placeEscrowHold(EscrowTransaction txn, UUID walletId, Actor actor,
                                          String idempotencyKey, String fingerprint) {
        if (txn.getStatus() != TransactionStatus.PAYMENT_PROCESSING
                || !idempotencyKey.equals(txn.getPaymentAttemptKey())) {
            // Another call moved the sale on between the two units
            throw new InvalidStateTransitionException(txn.getStatus(), TransactionStatus.ESCROW_HELD);
        }
        Hold hold = holdManager.placeHold(walletId, txn.getId(), txn.getAmount(), holdTtl);
        EscrowTransaction held = stateMachine.transition(txn, TransactionStatus.ESCROW_HELD, actor, "escrow hold placed");
        idempotencyService.save(idempotencyKey, OP_PAY, fingerprint, txn.getId(), hold.getId(), null);
        return new PaymentResult(held, hold);
    }

    private PaymentResult replayPayment(EscrowTransaction txn, IdempotencyRecord record) {
        Hold hold = record.getHoldId() != null ? holdManager.findById(record.getHoldId()).orElse(null) : null;
        return new PaymentResult(txn, hold);
    }

    /**
     * Puts a sale whose hold step failed back to PENDING. Runs with its own short deadline
     * because the caller's may be nearly spent; if it fails, the sweeper cancels the sale later.
     */
    private void revertToPending(UUID transactionId, String idempotencyKey, Actor actor, EscrowException cause) {
        try {
            transactionRunner.inTransaction(Deadline.after(Duration.ofSeconds(5), clock), () -> {
                EscrowTransaction txn = stateMachine.lock(transactionId);
                if (txn.getStatus() == TransactionStatus.PAYMENT_PROCESSING
                        && idempotencyKey.equals(txn.getPaymentAttemptKey())) {
                    stateMachine.transition(txn.toBuilder().paymentWalletId(null).build(),
                        TransactionStatus.PENDING, actor, "payment failed: " + cause.getCode());
                }
                return null;
            });
        } catch (RuntimeException e) {
            log.error("Could not return transaction {} to PENDING after {}", transactionId, cause.getCode(), e);
            cause.addSuppressed(e);
        }
    }

    private Optional<EscrowTransaction> findCreatedWithKey(String idempotencyKey, EscrowTransaction draft,
                                                          Deadline deadline) {
        return transactionRunner.readOnly(deadline, () -> repository.findByIdempotencyKey(idempotencyKey))
            .map(EscrowTransactionEntity::toDomain)
            .map(existing -> {
                boolean same = existing.getBuyerId().equals(draft.getBuyerId())
                    && existing.getSellerId().equals(draft.getSellerId())
                    && existing.getAmount() == draft.getAmount()
                    && existing.getCurrency() == draft.getCurrency()
                    && Objects.equals(existing.getListingRef(), draft.getListingRef());
                if (!same) {
                    throw new IdempotencyConflictException("Idempotency key was already used for a different sale");
                }
                metrics.recordIdempotencyHit();
                return existing;
            });
    }

    private Hold activeHold(EscrowTransaction txn) {
        return holdManager.findActiveByTransaction(txn.getId())
            .orElseThrow(() -> new IllegalStateException("Transaction " + txn.getId() + " has no active hold"));
    }

    private static boolean canSee(Actor actor, EscrowTransaction txn) {
        return actor.getRole() != ActorRole.USER || txn.isParty(actor.getId());
    }

    /**
     * Runs one locked state change; with a key, a completed identical call is replayed.
     */
    private OperationResult<EscrowTransaction> keyed(String operation, UUID transactionId, Actor actor,
                                                     String idempotencyKey, Deadline deadline,
                                                     Function<EscrowTransaction, EscrowTransaction> change) {
        String fingerprint = "txn=" + transactionId + "|actor=" + actor.getId();
        try (MDC.MDCCloseable ignored = CorrelationContext.withId(CorrelationContext.TRANSACTION_ID_MDC_KEY, transactionId)) {
            return transactionRunner.inTransaction(deadline, () -> {
                EscrowTransaction txn = stateMachine.lock(transactionId);
                if (idempotencyKey != null) {
                    if (idempotencyService.find(idempotencyKey, operation, fingerprint).isPresent()) {
                        return OperationResult.replayed(txn);
                    }
                }
                EscrowTransaction result = change.apply(txn);
                if (idempotencyKey != null) {
                    idempotencyService.save(idempotencyKey, operation, fingerprint, transactionId, null, null);
                }
                return OperationResult.executed(result);
            });
        } catch (EscrowException e) {
            metrics.recordRejected(operation != null ? operation : "refund_on_timeout", e.getCode().name());
            throw e;
        }
    }
}
