package com.flagship.escrow_engine.ledger;

import com.flagship.escrow_engine.error.ForbiddenException;
import com.flagship.escrow_engine.error.InvalidStateTransitionException;
import com.flagship.escrow_engine.error.NotFoundException;
import com.flagship.escrow_engine.observability.CorrelationContext;
import com.flagship.escrow_engine.observability.EscrowMetrics;
import com.flagship.escrow_engine.persistence.Deadline;
import com.flagship.escrow_engine.persistence.TransactionRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Wallet lifecycle and the external money flows (deposits and withdrawals).
 *
 * Deposits and withdrawals are the only operations that change the total amount
 * of money in the system. Both are idempotent on the caller's reference.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletService {

    private final LedgerStore ledgerStore;
    private final TransactionRunner transactionRunner;
    private final EscrowMetrics metrics;

    public Wallet createWallet(UUID ownerId, CurrencyCode currency, Deadline deadline) {
        if (LedgerStore.PLATFORM_OWNER_ID.equals(ownerId)) {
            throw new ForbiddenException("Owner id is reserved for platform wallets");
        }
        Wallet wallet = transactionRunner.inTransaction(deadline,
            () -> ledgerStore.getOrCreateWallet(ownerId, currency, WalletKind.USER));
        log.info("Wallet {} ready for owner {} in {}", wallet.getId(), ownerId, currency);
        return wallet;
    }

    public Wallet getWallet(UUID walletId, Deadline deadline) {
        return transactionRunner.readOnly(deadline, () -> ledgerStore.findWallet(walletId)
            .orElseThrow(() -> NotFoundException.of("Wallet", walletId)));
    }

    public List<Wallet> listWallets(UUID ownerId, Deadline deadline) {
        return transactionRunner.readOnly(deadline, () -> ledgerStore.findWalletsByOwner(ownerId));
    }

    public Wallet deposit(UUID walletId, long amount, String reference, Deadline deadline) {
        return moveExternal(walletId, amount, reference, EntryReason.DEPOSIT, deadline);
    }

    public Wallet withdraw(UUID walletId, long amount, String reference, Deadline deadline) {
        return moveExternal(walletId, amount, reference, EntryReason.WITHDRAWAL, deadline);
    }

    public Wallet block(UUID walletId, Deadline deadline) {
        return changeStatus(walletId, WalletStatus.ACTIVE, WalletStatus.BLOCKED, deadline);
    }

    public Wallet unblock(UUID walletId, Deadline deadline) {
        return changeStatus(walletId, WalletStatus.BLOCKED, WalletStatus.ACTIVE, deadline);
    }

    /**
     * Closes a user wallet. Only allowed once both balances are zero, so no money
     * can be stranded in a wallet that rejects every further operation.
     */
    public Wallet close(UUID walletId, Deadline deadline) {
        return transactionRunner.inTransaction(deadline, () -> {
            Wallet wallet = ledgerStore.lockWallet(walletId);
            if (wallet.getKind() == WalletKind.PLATFORM_FEE) {
                throw new ForbiddenException("Platform wallets cannot be closed");
            }
            if (wallet.getStatus() == WalletStatus.CLOSED) {
                throw new InvalidStateTransitionException(WalletStatus.CLOSED, WalletStatus.CLOSED);
            }
            if (wallet.getTotalBalance() != 0) {
                throw new InvalidStateTransitionException(
                    "Wallet " + walletId + " still holds " + wallet.getTotalBalance() + " and cannot be closed");
            }
            return ledgerStore.updateStatus(walletId, WalletStatus.CLOSED);
        });
    }

    public List<LedgerEntry> listEntries(UUID walletId, int page, int size, Deadline deadline) {
        return transactionRunner.readOnly(deadline, () -> {
            ledgerStore.findWallet(walletId).orElseThrow(() -> NotFoundException.of("Wallet", walletId));
            return ledgerStore.listEntries(walletId, size, page * size);
        });
    }

    public WalletReconciliation reconcile(UUID walletId, Deadline deadline) {
        WalletReconciliation result = transactionRunner.readOnly(deadline, () -> ledgerStore.reconcile(walletId));
        if (!result.isBalanced()) {
            log.error("Wallet {} drifted from its ledger: stored {}/{}, derived {}/{}",
                walletId, result.getStoredAvailable(), result.getStoredHeld(),
                result.getDerivedAvailable(), result.getDerivedHeld());
        }
        return result;
    }

    public List<CurrencyTotals> checkConservation(Deadline deadline) {
        List<CurrencyTotals> totals = transactionRunner.readOnly(deadline, ledgerStore::currencyTotals);
        totals.stream()
            .filter(t -> !t.isConserved())
            .forEach(t -> log.error("Conservation broken for {}: wallets hold {}, external net flow {}",
                t.getCurrency(), t.getTotalAvailable() + t.getTotalHeld(), t.getNetExternalFlow()));
        return totals;
    }

    private Wallet moveExternal(UUID walletId, long amount, String reference,
                                EntryReason reason, Deadline deadline) {
        if (reference == null || reference.isBlank()) {
            throw new IllegalArgumentException("A reference is required for " + reason.name().toLowerCase());
        }
        try (MDC.MDCCloseable ignored = CorrelationContext.withId(CorrelationContext.WALLET_ID_MDC_KEY, walletId)) {
            return transactionRunner.inTransaction(deadline, () -> {
                Wallet wallet = ledgerStore.lockWallet(walletId);
                if (wallet.getKind() == WalletKind.PLATFORM_FEE && reason == EntryReason.DEPOSIT) {
                    throw new ForbiddenException("Platform wallets only receive fees");
                }
                boolean applied = reason == EntryReason.DEPOSIT
                    ? ledgerStore.creditAvailable(walletId, amount, reason, reference)
                    : ledgerStore.debitAvailable(walletId, amount, reason, reference);
                if (applied) {
                    metrics.recordLedgerMovement(reason.name(), wallet.getCurrency().name());
                } else {
                    log.info("{} {} already applied to wallet {}", reason, reference, walletId);
                }
                return ledgerStore.lockWallet(walletId);
            });
        }
    }

    private Wallet changeStatus(UUID walletId, WalletStatus expected, WalletStatus target, Deadline deadline) {
        return transactionRunner.inTransaction(deadline, () -> {
            Wallet wallet = ledgerStore.lockWallet(walletId);
            if (wallet.getStatus() != expected) {
                throw new InvalidStateTransitionException(wallet.getStatus(), target);
            }
            return ledgerStore.updateStatus(walletId, target);
        });
    }
}
