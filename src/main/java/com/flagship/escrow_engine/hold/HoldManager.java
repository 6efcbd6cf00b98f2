package com.flagship.escrow_engine.hold;

import com.flagship.escrow_engine.error.DuplicateHoldException;
import com.flagship.escrow_engine.error.HoldNotActiveException;
import com.flagship.escrow_engine.error.InvalidAmountException;
import com.flagship.escrow_engine.error.NotFoundException;
import com.flagship.escrow_engine.ledger.CurrencyCode;
import com.flagship.escrow_engine.ledger.EntryReason;
import com.flagship.escrow_engine.ledger.LedgerStore;
import com.flagship.escrow_engine.ledger.Wallet;
import com.flagship.escrow_engine.observability.EscrowMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Places, extends, captures, releases and expires escrow holds.
 *
 * Every money movement goes through {@link LedgerStore}; this class only owns the
 * hold rows. Runs inside the caller's transaction, so the ledger entries and the
 * hold status flip commit together or not at all.
 *
 * At most one ACTIVE hold exists per transaction (partial unique index on holds).
 */
@Service
@Slf4j
@Transactional(propagation = Propagation.MANDATORY)
public class HoldManager {

    private static final String HOLD_COLUMNS =
        "id, wallet_id, transaction_id, amount, released_amount, captured_amount, currency, status, " +
        "created_at, expires_at, resolved_at";

    private final JdbcTemplate jdbcTemplate;
    private final LedgerStore ledgerStore;
    private final EscrowMetrics metrics;
    private final Clock clock;

    public HoldManager(JdbcTemplate jdbcTemplate, LedgerStore ledgerStore, EscrowMetrics metrics, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.ledgerStore = ledgerStore;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Moves {@code amount} from the wallet's available balance into a new hold.
     *
     * @throws com.flagship.escrow_engine.error.InsufficientFundsException if the wallet cannot cover it
     * @throws DuplicateHoldException if the transaction already has an active hold
     */
    public Hold placeHold(UUID walletId, UUID transactionId, long amount, Duration ttl) {
        if (amount <= 0) {
            throw new InvalidAmountException("Hold amount must be positive, got " + amount);
        }

        // Serializes concurrent holds on the same wallet before the duplicate check.
        Wallet wallet = ledgerStore.lockWallet(walletId);
        if (findActiveByTransaction(transactionId).isPresent()) {
            throw new DuplicateHoldException("Transaction " + transactionId + " already has an active hold");
        }

        Instant now = clock.instant();
        UUID holdId = UUID.randomUUID();
        try {
            jdbcTemplate.update(
                "INSERT INTO holds (" + HOLD_COLUMNS + ") VALUES (?, ?, ?, ?, 0, 0, ?, ?, ?, ?, NULL)",
                holdId, walletId, transactionId, amount, wallet.getCurrency().name(), HoldStatus.ACTIVE.name(),
                Timestamp.from(now), Timestamp.from(now.plus(ttl))
            );
        } catch (DuplicateKeyException e) {
            // Lost the race to a hold on another wallet for the same transaction
            throw new DuplicateHoldException("Transaction " + transactionId + " already has an active hold");
        }

        if (!ledgerStore.moveAvailableToHeld(walletId, amount, transactionId.toString())) {
            throw new DuplicateHoldException("Funds for transaction " + transactionId + " were already held");
        }

        metrics.recordHold("placed");
        metrics.recordLedgerMovement(EntryReason.HOLD.name(), wallet.getCurrency().name());
        log.info("Hold {} placed on wallet {} for transaction {}: {} {}",
            holdId, walletId, transactionId, amount, wallet.getCurrency());
        return getHold(holdId);
    }

    /**
     * Pays the remainder of the hold out: {@code remaining - feeAmount} to the payout wallet
     * and {@code feeAmount} to the platform fee wallet of the hold's currency.
     */
    public Hold captureHold(UUID holdId, UUID payoutWalletId, long feeAmount) {
        Hold hold = lockActiveHold(holdId);
        long remaining = hold.getRemaining();
        if (feeAmount < 0 || feeAmount > remaining) {
            throw new InvalidAmountException(
                String.format("Fee %d is outside [0, %d] for hold %s", feeAmount, remaining, holdId));
        }

        String ref = hold.getTransactionId().toString();
        Wallet feeWallet = ledgerStore.feeWallet(hold.getCurrency());
        ledgerStore.lockWallets(hold.getWalletId(), payoutWalletId, feeWallet.getId());

        long payout = remaining - feeAmount;
        if (payout > 0) {
            ledgerStore.releaseHeld(hold.getWalletId(), payout, payoutWalletId, EntryReason.CAPTURE, ref);
            metrics.recordLedgerMovement(EntryReason.CAPTURE.name(), hold.getCurrency().name());
        }
        if (feeAmount > 0) {
            ledgerStore.releaseHeld(hold.getWalletId(), feeAmount, feeWallet.getId(), EntryReason.FEE, ref);
            metrics.recordLedgerMovement(EntryReason.FEE.name(), hold.getCurrency().name());
        }

        HoldStatus status = hold.getReleasedAmount() > 0 ? HoldStatus.SPLIT : HoldStatus.CAPTURED;
        resolve(holdId, hold.getReleasedAmount(), hold.getCapturedAmount() + remaining, status);

        metrics.recordHold(status.name().toLowerCase());
        log.info("Hold {} captured: {} to wallet {}, fee {}", holdId, payout, payoutWalletId, feeAmount);
        return getHold(holdId);
    }

    /**
     * Returns {@code fraction} of what is still held to the payer's available balance.
     * A fraction below one leaves the hold ACTIVE for the paired capture of the remainder.
     *
     * @param fraction in (0, 1]; the released amount is rounded half-up to minor units
     */
    public Hold releaseHold(UUID holdId, BigDecimal fraction) {
        if (fraction == null || fraction.signum() <= 0 || fraction.compareTo(BigDecimal.ONE) > 0) {
            throw new InvalidAmountException("Release fraction must be in (0, 1], got " + fraction);
        }
        Hold hold = lockActiveHold(holdId);
        long remaining = hold.getRemaining();
        long toRelease = BigDecimal.valueOf(remaining).multiply(fraction)
            .setScale(0, RoundingMode.HALF_UP).longValueExact();
        if (toRelease <= 0) {
            throw new InvalidAmountException("Fraction " + fraction + " of " + remaining + " rounds to nothing");
        }

        ledgerStore.moveHeldToAvailable(hold.getWalletId(), toRelease, EntryReason.RELEASE,
            hold.getTransactionId().toString());
        metrics.recordLedgerMovement(EntryReason.RELEASE.name(), hold.getCurrency().name());

        long released = hold.getReleasedAmount() + toRelease;
        if (toRelease == remaining) {
            resolve(holdId, released, hold.getCapturedAmount(), HoldStatus.RELEASED);
            metrics.recordHold("released");
            log.info("Hold {} fully released: {} back to wallet {}", holdId, toRelease, hold.getWalletId());
        } else {
            jdbcTemplate.update("UPDATE holds SET released_amount = ? WHERE id = ?", released, holdId);
            log.info("Hold {} partly released: {} back to wallet {}, {} still held",
                holdId, toRelease, hold.getWalletId(), remaining - toRelease);
        }
        return getHold(holdId);
    }

    /**
     * Timeout path: returns everything still held to the payer with an EXPIRE entry.
     * Only legal from ACTIVE.
     */
    public Hold expireHold(UUID holdId) {
        Hold hold = lockActiveHold(holdId);
        long remaining = hold.getRemaining();
        ledgerStore.moveHeldToAvailable(hold.getWalletId(), remaining, EntryReason.EXPIRE,
            hold.getTransactionId().toString());
        metrics.recordLedgerMovement(EntryReason.EXPIRE.name(), hold.getCurrency().name());

        resolve(holdId, hold.getReleasedAmount() + remaining, hold.getCapturedAmount(), HoldStatus.EXPIRED);
        metrics.recordHold("expired");
        log.info("Hold {} expired: {} back to wallet {}", holdId, remaining, hold.getWalletId());
        return getHold(holdId);
    }

    /**
     * Pushes an active hold's expiry out. Never shortens it.
     */
    public Hold extendHold(UUID holdId, Instant newExpiresAt) {
        Hold hold = lockActiveHold(holdId);
        if (newExpiresAt.isAfter(hold.getExpiresAt())) {
            jdbcTemplate.update("UPDATE holds SET expires_at = ? WHERE id = ?", Timestamp.from(newExpiresAt), holdId);
            log.info("Hold {} extended to {}", holdId, newExpiresAt);
        }
        return getHold(holdId);
    }

    @Transactional(propagation = Propagation.SUPPORTS)
    public Optional<Hold> findById(UUID holdId) {
        return jdbcTemplate.query("SELECT " + HOLD_COLUMNS + " FROM holds WHERE id = ?", holdRowMapper(), holdId)
            .stream().findFirst();
    }

    @Transactional(propagation = Propagation.SUPPORTS)
    public Optional<Hold> findActiveByTransaction(UUID transactionId) {
        return jdbcTemplate.query(
            "SELECT " + HOLD_COLUMNS + " FROM holds WHERE transaction_id = ? AND status = 'ACTIVE'",
            holdRowMapper(), transactionId
        ).stream().findFirst();
    }

    @Transactional(propagation = Propagation.SUPPORTS)
    public List<Hold> findByTransaction(UUID transactionId) {
        return jdbcTemplate.query(
            "SELECT " + HOLD_COLUMNS + " FROM holds WHERE transaction_id = ? ORDER BY created_at",
            holdRowMapper(), transactionId);
    }

    public Hold getHold(UUID holdId) {
        return findById(holdId).orElseThrow(() -> NotFoundException.of("Hold", holdId));
    }

    private Hold lockActiveHold(UUID holdId) {
        Hold hold = jdbcTemplate.query(
            "SELECT " + HOLD_COLUMNS + " FROM holds WHERE id = ? FOR UPDATE", holdRowMapper(), holdId
        ).stream().findFirst().orElseThrow(() -> NotFoundException.of("Hold", holdId));
        if (!hold.isActive()) {
            throw new HoldNotActiveException("Hold " + holdId + " is already " + hold.getStatus());
        }
        return hold;
    }

    private void resolve(UUID holdId, long releasedAmount, long capturedAmount, HoldStatus status) {
        jdbcTemplate.update(
            "UPDATE holds SET released_amount = ?, captured_amount = ?, status = ?, resolved_at = ? WHERE id = ?",
            releasedAmount, capturedAmount, status.name(), Timestamp.from(clock.instant()), holdId);
    }

    private RowMapper<Hold> holdRowMapper() {
        return (rs, rowNum) -> {
            Timestamp resolvedAt = rs.getTimestamp("resolved_at");
            return new Hold(
                rs.getObject("id", UUID.class),
                rs.getObject("wallet_id", UUID.class),
                rs.getObject("transaction_id", UUID.class),
                rs.getLong("amount"),
                rs.getLong("released_amount"),
                rs.getLong("captured_amount"),
                CurrencyCode.valueOf(rs.getString("currency")),
                HoldStatus.valueOf(rs.getString("status")),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("expires_at").toInstant(),
                resolvedAt != null ? resolvedAt.toInstant() : null
            );
        };
    }
}
