package com.flagship.escrow_engine.dispute;

import com.flagship.escrow_engine.AbstractIntegrationTest;
import com.flagship.escrow_engine.error.AlreadyDisputedException;
import com.flagship.escrow_engine.error.AlreadyResolvedException;
import com.flagship.escrow_engine.error.ForbiddenException;
import com.flagship.escrow_engine.error.InvalidAmountException;
import com.flagship.escrow_engine.error.InvalidStateTransitionException;
import com.flagship.escrow_engine.error.NotFoundException;
import com.flagship.escrow_engine.hold.Hold;
import com.flagship.escrow_engine.hold.HoldStatus;
import com.flagship.escrow_engine.ledger.CurrencyCode;
import com.flagship.escrow_engine.ledger.Wallet;
import com.flagship.escrow_engine.transaction.Actor;
import com.flagship.escrow_engine.transaction.EscrowTransaction;
import com.flagship.escrow_engine.transaction.EscrowTransactionService;
import com.flagship.escrow_engine.transaction.OperationResult;
import com.flagship.escrow_engine.transaction.TransactionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class DisputeResolverTest extends AbstractIntegrationTest {

    @Autowired
    private DisputeResolver disputeResolver;

    @Autowired
    private EscrowTransactionService transactionService;

    private final Actor moderator = Actor.moderator(UUID.randomUUID());

    private UUID buyerId;
    private UUID sellerId;
    private Wallet buyerWallet;

    @BeforeEach
    void setUp() {
        buyerId = UUID.randomUUID();
        sellerId = UUID.randomUUID();
        buyerWallet = fundedWallet(buyerId, 10_000);
    }

    @Test
    @DisplayName("Split 0.5 of 10000: buyer gets 5000 back, seller gets 5000 minus half the 500 fee")
    void splitResolution() {
        // Given
        EscrowTransaction txn = heldSale(10_000);
        Dispute dispute = disputeResolver.open(txn.getId(), Actor.user(buyerId), "item damaged",
            List.of("photo-1", "photo-2"), null, deadline()).getValue();
        assertEquals(DisputeStatus.OPEN, dispute.getStatus());
        assertEquals(List.of("photo-1", "photo-2"), dispute.getEvidenceRefs());

        // When
        DisputeResolver.Resolution resolution = disputeResolver.resolve(dispute.getId(), moderator,
            DisputeOutcome.SPLIT, new BigDecimal("0.5"), "both at fault", null, deadline()).getValue();

        // Then
        assertEquals(TransactionStatus.RESOLVED_SPLIT, resolution.getTransaction().getStatus());
        Dispute resolved = resolution.getDispute();
        assertEquals(DisputeStatus.RESOLVED_SPLIT, resolved.getStatus());
        assertEquals(5_000L, resolved.getBuyerAmount());
        assertEquals(4_750L, resolved.getSellerAmount());
        assertEquals(250L, resolved.getFeeAmount());
        assertEquals(moderator.getId(), resolved.getResolverId());

        Wallet buyer = reload(buyerWallet);
        assertEquals(5_000, buyer.getAvailableBalance());
        assertEquals(0, buyer.getHeldBalance());
        assertEquals(4_750, sellerWallet().getAvailableBalance());

        Hold hold = transactionService.holds(txn.getId(), moderator, deadline()).get(0);
        assertEquals(HoldStatus.SPLIT, hold.getStatus());
        assertEquals(5_000, hold.getReleasedAmount());
        assertEquals(5_000, hold.getCapturedAmount());
    }

    @Test
    @DisplayName("Splitting a 20bn sale takes half the fee without overflowing")
    void largeSplitResolution() {
        long amount = 20_000_000_000L;
        buyerWallet = walletService.deposit(buyerWallet.getId(), amount, "dep-large-" + UUID.randomUUID(), deadline());
        EscrowTransaction txn = heldSale(amount);
        assertEquals(1_000_000_000L, txn.getFeeAmount());
        Dispute dispute = open(txn, buyerId);

        Dispute resolved = disputeResolver.resolve(dispute.getId(), moderator,
            DisputeOutcome.SPLIT, new BigDecimal("0.5"), null, null, deadline()).getValue().getDispute();

        assertEquals(10_000_000_000L, resolved.getBuyerAmount());
        assertEquals(500_000_000L, resolved.getFeeAmount());
        assertEquals(9_500_000_000L, resolved.getSellerAmount());
        assertEquals(9_500_000_000L, sellerWallet().getAvailableBalance());
        assertEquals(10_000_000_000L + 10_000, reload(buyerWallet).getAvailableBalance());
    }

    @Test
    @DisplayName("Buyer outcome returns the full amount and charges no fee")
    void buyerResolution() {
        EscrowTransaction txn = heldSale(6_000);
        Dispute dispute = open(txn, sellerId);

        DisputeResolver.Resolution resolution = disputeResolver.resolve(dispute.getId(), moderator,
            DisputeOutcome.BUYER, null, null, null, deadline()).getValue();

        assertEquals(TransactionStatus.RESOLVED_BUYER, resolution.getTransaction().getStatus());
        assertEquals(6_000L, resolution.getDispute().getBuyerAmount());
        assertEquals(0L, resolution.getDispute().getFeeAmount());
        assertEquals(10_000, reload(buyerWallet).getAvailableBalance());
        assertEquals(HoldStatus.RELEASED, transactionService.holds(txn.getId(), moderator, deadline()).get(0).getStatus());
    }

    @Test
    @DisplayName("Seller outcome pays the amount minus the full fee")
    void sellerResolution() {
        EscrowTransaction txn = heldSale(4_000);
        Dispute dispute = open(txn, buyerId);

        DisputeResolver.Resolution resolution = disputeResolver.resolve(dispute.getId(), moderator,
            DisputeOutcome.SELLER, null, "delivered as described", null, deadline()).getValue();

        assertEquals(TransactionStatus.RESOLVED_SELLER, resolution.getTransaction().getStatus());
        assertEquals(3_800L, resolution.getDispute().getSellerAmount());
        assertEquals(200L, resolution.getDispute().getFeeAmount());
        assertEquals(3_800, sellerWallet().getAvailableBalance());
        assertEquals(6_000, reload(buyerWallet).getTotalBalance());
    }

    @Test
    @DisplayName("A dispute is decided once; a keyed retry replays instead of failing")
    void resolvedOnlyOnce() {
        EscrowTransaction txn = heldSale(2_000);
        Dispute dispute = open(txn, buyerId);
        String key = "resolve-" + dispute.getId();

        OperationResult<DisputeResolver.Resolution> first = disputeResolver.resolve(dispute.getId(), moderator,
            DisputeOutcome.BUYER, null, null, key, deadline());
        OperationResult<DisputeResolver.Resolution> retry = disputeResolver.resolve(dispute.getId(), moderator,
            DisputeOutcome.BUYER, null, null, key, deadline());

        assertFalse(first.isReplayed());
        assertTrue(retry.isReplayed());
        assertThrows(AlreadyResolvedException.class, () -> disputeResolver.resolve(dispute.getId(), moderator,
            DisputeOutcome.SELLER, null, null, null, deadline()));
        assertEquals(10_000, reload(buyerWallet).getAvailableBalance());
    }

    @Test
    @DisplayName("Only moderators resolve; only parties open; one dispute per sale")
    void permissionsAndUniqueness() {
        EscrowTransaction txn = heldSale(1_000);

        assertThrows(ForbiddenException.class, () -> disputeResolver.open(txn.getId(),
            Actor.user(UUID.randomUUID()), "not mine", List.of(), null, deadline()));

        Dispute dispute = open(txn, buyerId);
        assertThrows(AlreadyDisputedException.class, () -> disputeResolver.open(txn.getId(),
            Actor.user(sellerId), "me too", List.of(), null, deadline()));
        assertThrows(ForbiddenException.class, () -> disputeResolver.resolve(dispute.getId(),
            Actor.user(buyerId), DisputeOutcome.BUYER, null, null, null, deadline()));
        assertThrows(NotFoundException.class, () -> disputeResolver.get(dispute.getId(),
            Actor.user(UUID.randomUUID()), deadline()));
        assertEquals(dispute.getId(), disputeResolver.get(dispute.getId(), Actor.user(sellerId), deadline()).getId());
    }

    @Test
    @DisplayName("Disputes cannot be opened on a PENDING or completed sale")
    void openRequiresMoneyInFlight() {
        EscrowTransaction pending = transactionService.create(buyerId, sellerId, "listing", 1_000,
            CurrencyCode.USD, Actor.user(buyerId), null, deadline()).getValue();
        assertThrows(InvalidStateTransitionException.class, () -> open(pending, buyerId));

        EscrowTransaction held = heldSale(1_000);
        transactionService.confirmDelivery(held.getId(), Actor.user(buyerId), null, deadline());
        assertThrows(InvalidStateTransitionException.class, () -> open(held, buyerId));
    }

    @Test
    @DisplayName("Split ratios must leave both sides something")
    void splitRatioBounds() {
        EscrowTransaction txn = heldSale(1_000);
        Dispute dispute = open(txn, buyerId);

        assertThrows(InvalidAmountException.class, () -> disputeResolver.resolve(dispute.getId(), moderator,
            DisputeOutcome.SPLIT, null, null, null, deadline()));
        assertThrows(InvalidAmountException.class, () -> disputeResolver.resolve(dispute.getId(), moderator,
            DisputeOutcome.SPLIT, BigDecimal.ONE, null, null, deadline()));
        assertThrows(InvalidAmountException.class, () -> disputeResolver.resolve(dispute.getId(), moderator,
            DisputeOutcome.SPLIT, new BigDecimal("0.0001"), null, null, deadline()));

        // Nothing moved by the rejected attempts
        assertEquals(1_000, reload(buyerWallet).getHeldBalance());
        assertEquals(DisputeStatus.OPEN, disputeResolver.get(dispute.getId(), moderator, deadline()).getStatus());
    }

    @Test
    @DisplayName("Opening a dispute extends the hold and escalation happens at most once")
    void holdExtendedAndEscalatedOnce() {
        EscrowTransaction txn = heldSale(1_000);
        Hold before = transactionService.holds(txn.getId(), moderator, deadline()).get(0);
        Dispute dispute = open(txn, buyerId);
        Hold after = transactionService.holds(txn.getId(), moderator, deadline()).get(0);
        assertFalse(after.getExpiresAt().isBefore(before.getExpiresAt()));

        assertTrue(disputeResolver.findDueForEscalation(clock.instant().plus(Duration.ofMinutes(1)), 1_000, deadline())
            .contains(dispute.getId()));
        assertTrue(disputeResolver.escalate(dispute.getId(), deadline()));
        assertFalse(disputeResolver.escalate(dispute.getId(), deadline()));
        assertNotNull(disputeResolver.get(dispute.getId(), moderator, deadline()).getEscalatedAt());
        assertFalse(disputeResolver.findDueForEscalation(clock.instant().plus(Duration.ofMinutes(1)), 1_000, deadline())
            .contains(dispute.getId()));
        // Escalation leaves the money alone
        assertEquals(1_000, reload(buyerWallet).getHeldBalance());
    }

    @Test
    @DisplayName("Buyer share rounds half-up and must be in [1, amount - 1]")
    void buyerShareRounding() {
        assertEquals(5_000, DisputeResolver.buyerShare(10_000, new BigDecimal("0.5")));
        assertEquals(2, DisputeResolver.buyerShare(3, new BigDecimal("0.5")));
        assertEquals(3_333, DisputeResolver.buyerShare(10_000, new BigDecimal("0.3333")));
        assertThrows(InvalidAmountException.class, () -> DisputeResolver.buyerShare(1, new BigDecimal("0.5")));
        assertThrows(InvalidAmountException.class, () -> DisputeResolver.buyerShare(100, new BigDecimal("0.999")));
    }

    private EscrowTransaction heldSale(long amount) {
        EscrowTransaction txn = transactionService.create(buyerId, sellerId, "listing-" + UUID.randomUUID(),
            amount, CurrencyCode.USD, Actor.user(buyerId), null, deadline()).getValue();
        return transactionService.initiatePayment(txn.getId(), buyerWallet.getId(), Actor.user(buyerId),
            "pay-" + txn.getId(), deadline()).getValue().getTransaction();
    }

    private Dispute open(EscrowTransaction txn, UUID openerId) {
        return disputeResolver.open(txn.getId(), Actor.user(openerId), "not as described", List.of(),
            null, deadline()).getValue();
    }

    private Wallet sellerWallet() {
        return walletService.listWallets(sellerId, deadline()).get(0);
    }
}
