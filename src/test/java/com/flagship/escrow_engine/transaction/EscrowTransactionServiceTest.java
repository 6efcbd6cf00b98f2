package com.flagship.escrow_engine.transaction;

import com.flagship.escrow_engine.AbstractIntegrationTest;
import com.flagship.escrow_engine.dispute.DisputeResolver;
import com.flagship.escrow_engine.error.EscrowException;
import com.flagship.escrow_engine.error.ForbiddenException;
import com.flagship.escrow_engine.error.IdempotencyConflictException;
import com.flagship.escrow_engine.error.InsufficientFundsException;
import com.flagship.escrow_engine.error.InvalidStateTransitionException;
import com.flagship.escrow_engine.error.NotFoundException;
import com.flagship.escrow_engine.error.SamePartyException;
import com.flagship.escrow_engine.hold.Hold;
import com.flagship.escrow_engine.hold.HoldStatus;
import com.flagship.escrow_engine.ledger.CurrencyCode;
import com.flagship.escrow_engine.ledger.EntryReason;
import com.flagship.escrow_engine.ledger.LedgerEntry;
import com.flagship.escrow_engine.ledger.Wallet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EscrowTransactionServiceTest extends AbstractIntegrationTest {

    @Autowired
    private EscrowTransactionService transactionService;

    @Autowired
    private DisputeResolver disputeResolver;

    @Test
    @DisplayName("Happy path: pay 8000 from 10000, confirm, seller gets 8000 minus the 400 fee")
    void happyPath() {
        // Given
        UUID buyerId = UUID.randomUUID();
        UUID sellerId = UUID.randomUUID();
        Wallet buyerWallet = fundedWallet(buyerId, 10_000);
        EscrowTransaction txn = createSale(buyerId, sellerId, 8_000);
        assertEquals(TransactionStatus.PENDING, txn.getStatus());
        assertEquals(400, txn.getFeeAmount());

        // When: buyer pays
        OperationResult<PaymentResult> payment = transactionService.initiatePayment(
            txn.getId(), buyerWallet.getId(), Actor.user(buyerId), "pay-" + txn.getId(), deadline());

        // Then
        assertFalse(payment.isReplayed());
        assertEquals(TransactionStatus.ESCROW_HELD, payment.getValue().getTransaction().getStatus());
        assertEquals(8_000, payment.getValue().getHold().getAmount());
        Wallet afterHold = reload(buyerWallet);
        assertEquals(2_000, afterHold.getAvailableBalance());
        assertEquals(8_000, afterHold.getHeldBalance());

        // When: buyer confirms
        EscrowTransaction completed = transactionService
            .confirmDelivery(txn.getId(), Actor.user(buyerId), null, deadline()).getValue();

        // Then
        assertEquals(TransactionStatus.COMPLETED, completed.getStatus());
        assertNotNull(completed.getClosedAt());
        assertEquals(2_000, reload(buyerWallet).getTotalBalance());
        Wallet sellerWallet = walletService.listWallets(sellerId, deadline()).get(0);
        assertEquals(7_600, sellerWallet.getAvailableBalance());

        List<TransactionHistoryEvent> history = transactionService.history(txn.getId(), Actor.user(buyerId), deadline());
        assertEquals(List.of(TransactionStatus.PENDING, TransactionStatus.PAYMENT_PROCESSING,
                TransactionStatus.ESCROW_HELD, TransactionStatus.COMPLETED),
            history.stream().map(TransactionHistoryEvent::getToStatus).toList());

        List<Hold> holds = transactionService.holds(txn.getId(), Actor.user(sellerId), deadline());
        assertEquals(1, holds.size());
        assertEquals(HoldStatus.CAPTURED, holds.get(0).getStatus());
    }

    @Test
    @DisplayName("Retrying a payment with the same key places exactly one hold")
    void paymentRetryIsIdempotent() {
        UUID buyerId = UUID.randomUUID();
        Wallet buyerWallet = fundedWallet(buyerId, 5_000);
        EscrowTransaction txn = createSale(buyerId, UUID.randomUUID(), 3_000);
        String key = "pay-" + UUID.randomUUID();

        OperationResult<PaymentResult> first = transactionService.initiatePayment(
            txn.getId(), buyerWallet.getId(), Actor.user(buyerId), key, deadline());
        OperationResult<PaymentResult> second = transactionService.initiatePayment(
            txn.getId(), buyerWallet.getId(), Actor.user(buyerId), key, deadline());

        assertFalse(first.isReplayed());
        assertTrue(second.isReplayed());
        assertEquals(first.getValue().getHold().getId(), second.getValue().getHold().getId());
        assertEquals(1, transactionService.holds(txn.getId(), Actor.user(buyerId), deadline()).size());

        List<LedgerEntry> holdEntries = walletService.listEntries(buyerWallet.getId(), 0, 50, deadline()).stream()
            .filter(entry -> entry.getReason() == EntryReason.HOLD)
            .toList();
        assertEquals(1, holdEntries.size());
        assertEquals(2_000, reload(buyerWallet).getAvailableBalance());
    }

    @Test
    @DisplayName("The same payment key with another wallet is an idempotency conflict")
    void paymentKeyReusedWithOtherWallet() {
        UUID buyerId = UUID.randomUUID();
        Wallet first = fundedWallet(buyerId, 5_000);
        EscrowTransaction txn = createSale(buyerId, UUID.randomUUID(), 1_000);
        String key = "pay-" + UUID.randomUUID();
        transactionService.initiatePayment(txn.getId(), first.getId(), Actor.user(buyerId), key, deadline());

        EscrowException e = assertThrows(EscrowException.class, () -> transactionService.initiatePayment(
            txn.getId(), UUID.randomUUID(), Actor.user(buyerId), key, deadline()));
        assertTrue(e instanceof IdempotencyConflictException || e instanceof InvalidStateTransitionException,
            () -> "Unexpected " + e);
    }

    @Test
    @DisplayName("Insufficient funds leave the sale PENDING and the wallet untouched")
    void insufficientFundsRevertsToPending() {
        UUID buyerId = UUID.randomUUID();
        Wallet buyerWallet = fundedWallet(buyerId, 500);
        EscrowTransaction txn = createSale(buyerId, UUID.randomUUID(), 1_000);

        InsufficientFundsException e = assertThrows(InsufficientFundsException.class,
            () -> transactionService.initiatePayment(
                txn.getId(), buyerWallet.getId(), Actor.user(buyerId), "pay-" + txn.getId(), deadline()));

        assertEquals(1_000, e.getRequested());
        assertEquals(500, e.getAvailable());
        EscrowTransaction after = transactionService.get(txn.getId(), Actor.user(buyerId), deadline());
        assertEquals(TransactionStatus.PENDING, after.getStatus());
        assertNull(after.getPaymentWalletId());
        Wallet wallet = reload(buyerWallet);
        assertEquals(500, wallet.getAvailableBalance());
        assertEquals(0, wallet.getHeldBalance());
        assertTrue(transactionService.holds(txn.getId(), Actor.user(buyerId), deadline()).isEmpty());

        // A topped-up wallet can pay with a fresh key
        walletService.deposit(buyerWallet.getId(), 1_000, "top-up-" + txn.getId(), deadline());
        PaymentResult paid = transactionService.initiatePayment(
            txn.getId(), buyerWallet.getId(), Actor.user(buyerId), "pay-again-" + txn.getId(), deadline()).getValue();
        assertEquals(TransactionStatus.ESCROW_HELD, paid.getTransaction().getStatus());
    }

    @Test
    @DisplayName("Only the buyer may pay and confirm")
    void sellerCannotPayOrConfirm() {
        UUID buyerId = UUID.randomUUID();
        UUID sellerId = UUID.randomUUID();
        Wallet buyerWallet = fundedWallet(buyerId, 2_000);
        Wallet sellerWallet = fundedWallet(sellerId, 2_000);
        EscrowTransaction txn = createSale(buyerId, sellerId, 1_000);

        assertThrows(ForbiddenException.class, () -> transactionService.initiatePayment(
            txn.getId(), sellerWallet.getId(), Actor.user(sellerId), "pay-" + UUID.randomUUID(), deadline()));

        transactionService.initiatePayment(txn.getId(), buyerWallet.getId(), Actor.user(buyerId),
            "pay-" + txn.getId(), deadline());

        assertThrows(ForbiddenException.class,
            () -> transactionService.confirmDelivery(txn.getId(), Actor.user(sellerId), null, deadline()));
        assertEquals(TransactionStatus.ESCROW_HELD,
            transactionService.get(txn.getId(), Actor.user(buyerId), deadline()).getStatus());
    }

    @Test
    @DisplayName("Strangers cannot see a sale; the answer is the same as for a missing one")
    void strangersGetNotFound() {
        EscrowTransaction txn = createSale(UUID.randomUUID(), UUID.randomUUID(), 1_000);

        assertThrows(NotFoundException.class,
            () -> transactionService.get(txn.getId(), Actor.user(UUID.randomUUID()), deadline()));
        assertThrows(NotFoundException.class,
            () -> transactionService.get(UUID.randomUUID(), Actor.system(), deadline()));
        assertEquals(txn.getId(),
            transactionService.get(txn.getId(), Actor.moderator(UUID.randomUUID()), deadline()).getId());
    }

    @Test
    @DisplayName("A PENDING sale can be canceled, but not once money is held")
    void cancel() {
        UUID buyerId = UUID.randomUUID();
        UUID sellerId = UUID.randomUUID();
        EscrowTransaction pending = createSale(buyerId, sellerId, 1_000);

        EscrowTransaction canceled = transactionService
            .cancel(pending.getId(), Actor.user(sellerId), null, deadline()).getValue();
        assertEquals(TransactionStatus.CANCELED, canceled.getStatus());
        assertThrows(InvalidStateTransitionException.class,
            () -> transactionService.cancel(pending.getId(), Actor.user(buyerId), null, deadline()));

        Wallet buyerWallet = fundedWallet(buyerId, 1_000);
        EscrowTransaction held = createSale(buyerId, sellerId, 1_000);
        transactionService.initiatePayment(held.getId(), buyerWallet.getId(), Actor.user(buyerId),
            "pay-" + held.getId(), deadline());
        assertThrows(InvalidStateTransitionException.class,
            () -> transactionService.cancel(held.getId(), Actor.user(buyerId), null, deadline()));
    }

    @Test
    @DisplayName("Create with the same key returns the first sale; a different sale under that key conflicts")
    void createReplay() {
        UUID buyerId = UUID.randomUUID();
        UUID sellerId = UUID.randomUUID();
        String key = "create-" + UUID.randomUUID();

        OperationResult<EscrowTransaction> first = transactionService.create(buyerId, sellerId, "listing-1",
            2_000, CurrencyCode.USD, Actor.user(buyerId), key, deadline());
        OperationResult<EscrowTransaction> again = transactionService.create(buyerId, sellerId, "listing-1",
            2_000, CurrencyCode.USD, Actor.user(buyerId), key, deadline());

        assertFalse(first.isReplayed());
        assertTrue(again.isReplayed());
        assertEquals(first.getValue().getId(), again.getValue().getId());

        assertThrows(IdempotencyConflictException.class, () -> transactionService.create(buyerId, sellerId,
            "listing-1", 2_500, CurrencyCode.USD, Actor.user(buyerId), key, deadline()));
    }

    @Test
    @DisplayName("Buyer and seller must differ")
    void samePartyRejected() {
        UUID userId = UUID.randomUUID();
        assertThrows(SamePartyException.class, () -> transactionService.create(userId, userId, "listing",
            1_000, CurrencyCode.USD, Actor.user(userId), null, deadline()));
    }

    @Test
    @DisplayName("Confirm delivery racing open dispute: exactly one of them wins")
    void confirmRacesDispute() throws InterruptedException {
        // Given
        UUID buyerId = UUID.randomUUID();
        UUID sellerId = UUID.randomUUID();
        Wallet buyerWallet = fundedWallet(buyerId, 3_000);
        EscrowTransaction txn = createSale(buyerId, sellerId, 3_000);
        transactionService.initiatePayment(txn.getId(), buyerWallet.getId(), Actor.user(buyerId),
            "pay-" + txn.getId(), deadline());

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(2);
        AtomicInteger wins = new AtomicInteger();
        AtomicInteger losses = new AtomicInteger();
        List<Throwable> unexpected = new ArrayList<>();

        List<Runnable> contenders = List.of(
            () -> transactionService.confirmDelivery(txn.getId(), Actor.user(buyerId), null, deadline()),
            () -> disputeResolver.open(txn.getId(), Actor.user(sellerId), "buyer says not delivered", List.of(),
                null, deadline()));

        // When
        for (Runnable contender : contenders) {
            executor.submit(() -> {
                try {
                    start.await();
                    contender.run();
                    wins.incrementAndGet();
                } catch (InvalidStateTransitionException e) {
                    losses.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (RuntimeException e) {
                    synchronized (unexpected) {
                        unexpected.add(e);
                    }
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        // Then
        assertTrue(unexpected.isEmpty(), () -> "Unexpected failures: " + unexpected);
        assertEquals(1, wins.get());
        assertEquals(1, losses.get());
        TransactionStatus finalStatus = transactionService.get(txn.getId(), Actor.user(buyerId), deadline()).getStatus();
        assertTrue(finalStatus == TransactionStatus.COMPLETED || finalStatus == TransactionStatus.DISPUTED);
        Optional<Hold> hold = transactionService.holds(txn.getId(), Actor.user(buyerId), deadline()).stream().findFirst();
        assertTrue(hold.isPresent());
        assertEquals(finalStatus == TransactionStatus.COMPLETED ? HoldStatus.CAPTURED : HoldStatus.ACTIVE,
            hold.get().getStatus());
    }

    @Test
    @DisplayName("Users list only their own sales, filtered by role and status")
    void listByParty() {
        UUID buyerId = UUID.randomUUID();
        UUID sellerId = UUID.randomUUID();
        createSale(buyerId, sellerId, 1_000);
        createSale(buyerId, sellerId, 2_000);
        createSale(sellerId, buyerId, 3_000);

        assertEquals(3, transactionService.listByParty(buyerId, PartyRole.ANY, null, 0, 10,
            Actor.user(buyerId), deadline()).getTotalElements());
        assertEquals(2, transactionService.listByParty(buyerId, PartyRole.BUYER, TransactionStatus.PENDING, 0, 10,
            Actor.user(buyerId), deadline()).getTotalElements());
        assertEquals(0, transactionService.listByParty(buyerId, PartyRole.BUYER, TransactionStatus.COMPLETED, 0, 10,
            Actor.user(buyerId), deadline()).getTotalElements());
        assertThrows(ForbiddenException.class, () -> transactionService.listByParty(buyerId, PartyRole.ANY, null,
            0, 10, Actor.user(sellerId), deadline()));
    }

    private EscrowTransaction createSale(UUID buyerId, UUID sellerId, long amount) {
        return transactionService.create(buyerId, sellerId, "listing-" + UUID.randomUUID(), amount,
            CurrencyCode.USD, Actor.user(buyerId), null, deadline()).getValue();
    }
}
