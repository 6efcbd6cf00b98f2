package com.flagship.escrow_engine.ledger;

import com.flagship.escrow_engine.error.CurrencyMismatchException;
import com.flagship.escrow_engine.error.IdempotencyConflictException;
import com.flagship.escrow_engine.error.InsufficientFundsException;
import com.flagship.escrow_engine.error.InvalidAmountException;
import com.flagship.escrow_engine.error.InvalidStateTransitionException;
import com.flagship.escrow_engine.error.NotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable record of wallets and their entries, and the only code that writes wallet rows.
 *
 * Invariants enforced here:
 * 1. Every balance change is one or more immutable entries plus the matching balance update,
 *    written in the caller's database transaction (MANDATORY propagation)
 * 2. A wallet is mutated only while its row is locked ({@code SELECT ... FOR UPDATE});
 *    multi-wallet operations lock in a fixed order
 * 3. {@code (wallet_id, txn_ref, reason)} is unique, so re-applying an operation is a no-op;
 *    reusing the key for a different movement is rejected
 * 4. Balances never go negative (checked here and by CHECK constraints)
 *
 * Mutating primitives return {@code true} when they applied and {@code false} when the
 * same operation had already been applied.
 */
@Service
@Slf4j
@Transactional(propagation = Propagation.MANDATORY)
public class LedgerStore {

    /** Owner id of the per-currency platform fee wallets. */
    public static final UUID PLATFORM_OWNER_ID = new UUID(0L, 1L);

    private static final String WALLET_COLUMNS =
        "id, owner_id, currency, kind, available_balance, held_balance, status, version, created_at, updated_at";

    private static final String ENTRY_COLUMNS =
        "id, wallet_id, amount, available_delta, held_delta, currency, reason, txn_ref, description, " +
        "created_at, sequence_number";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public LedgerStore(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    /**
     * Returns the wallet for (owner, currency), creating it if it does not exist yet.
     * Safe under concurrent calls: the unique constraint decides the single winner.
     */
    public Wallet getOrCreateWallet(UUID ownerId, CurrencyCode currency, WalletKind kind) {
        Instant now = clock.instant();
        jdbcTemplate.update(
            "INSERT INTO wallets (" + WALLET_COLUMNS + ") VALUES (?, ?, ?, ?, 0, 0, ?, 0, ?, ?) " +
            "ON CONFLICT (owner_id, currency) DO NOTHING",
            UUID.randomUUID(), ownerId, currency.name(), kind.name(), WalletStatus.ACTIVE.name(),
            Timestamp.from(now), Timestamp.from(now)
        );
        return findWalletByOwner(ownerId, currency)
            .orElseThrow(() -> new IllegalStateException("Wallet missing right after insert: " + ownerId));
    }

    public Wallet feeWallet(CurrencyCode currency) {
        return getOrCreateWallet(PLATFORM_OWNER_ID, currency, WalletKind.PLATFORM_FEE);
    }

    @Transactional(propagation = Propagation.SUPPORTS)
    public Optional<Wallet> findWallet(UUID walletId) {
        List<Wallet> rows = jdbcTemplate.query(
            "SELECT " + WALLET_COLUMNS + " FROM wallets WHERE id = ?", walletRowMapper(), walletId);
        return rows.stream().findFirst();
    }

    @Transactional(propagation = Propagation.SUPPORTS)
    public Optional<Wallet> findWalletByOwner(UUID ownerId, CurrencyCode currency) {
        List<Wallet> rows = jdbcTemplate.query(
            "SELECT " + WALLET_COLUMNS + " FROM wallets WHERE owner_id = ? AND currency = ?",
            walletRowMapper(), ownerId, currency.name());
        return rows.stream().findFirst();
    }

    @Transactional(propagation = Propagation.SUPPORTS)
    public List<Wallet> findWalletsByOwner(UUID ownerId) {
        return jdbcTemplate.query(
            "SELECT " + WALLET_COLUMNS + " FROM wallets WHERE owner_id = ? ORDER BY currency",
            walletRowMapper(), ownerId);
    }

    /**
     * Locks the wallet row for the rest of the current transaction and returns its current state.
     */
    public Wallet lockWallet(UUID walletId) {
        List<Wallet> rows = jdbcTemplate.query(
            "SELECT " + WALLET_COLUMNS + " FROM wallets WHERE id = ? FOR UPDATE", walletRowMapper(), walletId);
        return rows.stream().findFirst().orElseThrow(() -> NotFoundException.of("Wallet", walletId));
    }

    /**
     * Locks several wallets in ascending id order so concurrent multi-wallet operations
     * cannot deadlock against each other.
     */
    public void lockWallets(UUID... walletIds) {
        Arrays.stream(walletIds).distinct().sorted().forEach(this::lockWallet);
    }

    public boolean creditAvailable(UUID walletId, long amount, EntryReason reason, String txnRef) {
        requirePositive(amount);
        Wallet wallet = lockWallet(walletId);
        if (alreadyApplied(walletId, txnRef, reason, amount, 0)) {
            return false;
        }
        requireCreditable(wallet);
        return apply(wallet, amount, 0, reason, txnRef, reason.name().toLowerCase() + " credit");
    }

    public boolean debitAvailable(UUID walletId, long amount, EntryReason reason, String txnRef) {
        requirePositive(amount);
        Wallet wallet = lockWallet(walletId);
        if (alreadyApplied(walletId, txnRef, reason, -amount, 0)) {
            return false;
        }
        requireDebitable(wallet);
        requireAvailable(wallet, amount);
        return apply(wallet, -amount, 0, reason, txnRef, reason.name().toLowerCase() + " debit");
    }

    public boolean moveAvailableToHeld(UUID walletId, long amount, String txnRef) {
        requirePositive(amount);
        Wallet wallet = lockWallet(walletId);
        if (alreadyApplied(walletId, txnRef, EntryReason.HOLD, -amount, amount)) {
            return false;
        }
        requireDebitable(wallet);
        requireAvailable(wallet, amount);
        return apply(wallet, -amount, amount, EntryReason.HOLD, txnRef, "funds placed on hold");
    }

    /**
     * Returns held funds to the same wallet's available balance.
     *
     * @param reason RELEASE for a decision, EXPIRE for a timeout
     */
    public boolean moveHeldToAvailable(UUID walletId, long amount, EntryReason reason, String txnRef) {
        requirePositive(amount);
        if (reason != EntryReason.RELEASE && reason != EntryReason.EXPIRE) {
            throw new IllegalArgumentException("Held funds return with RELEASE or EXPIRE, not " + reason);
        }
        Wallet wallet = lockWallet(walletId);
        if (alreadyApplied(walletId, txnRef, reason, amount, -amount)) {
            return false;
        }
        requireHeld(wallet, amount);
        return apply(wallet, amount, -amount, reason, txnRef, "held funds returned");
    }

    /**
     * Pays held funds out of one wallet into another wallet's available balance.
     * Writes one entry on each side; both or neither are applied.
     *
     * @param reason CAPTURE for the payout to the seller, FEE for the platform cut
     */
    public boolean releaseHeld(UUID walletId, long amount, UUID destinationWalletId, EntryReason reason, String txnRef) {
        requirePositive(amount);
        if (reason != EntryReason.CAPTURE && reason != EntryReason.FEE) {
            throw new IllegalArgumentException("Held funds pay out with CAPTURE or FEE, not " + reason);
        }
        if (walletId.equals(destinationWalletId)) {
            throw new IllegalArgumentException("Source and destination wallet must differ");
        }

        lockWallets(walletId, destinationWalletId);
        Wallet source = lockWallet(walletId);
        Wallet destination = lockWallet(destinationWalletId);

        if (alreadyApplied(walletId, txnRef, reason, 0, -amount)) {
            return false;
        }
        if (source.getCurrency() != destination.getCurrency()) {
            throw new CurrencyMismatchException(String.format(
                "Cannot move %s funds into a %s wallet", source.getCurrency(), destination.getCurrency()));
        }
        requireHeld(source, amount);
        requireCreditable(destination);

        apply(source, 0, -amount, reason, txnRef, "held funds paid out to " + destinationWalletId);
        apply(destination, amount, 0, reason, txnRef, "payout from " + walletId);
        return true;
    }

    public Wallet updateStatus(UUID walletId, WalletStatus status) {
        Wallet wallet = lockWallet(walletId);
        jdbcTemplate.update(
            "UPDATE wallets SET status = ?, version = version + 1, updated_at = ? WHERE id = ?",
            status.name(), Timestamp.from(clock.instant()), walletId);
        log.info("Wallet {} status {} -> {}", walletId, wallet.getStatus(), status);
        return lockWallet(walletId);
    }

    @Transactional(propagation = Propagation.SUPPORTS)
    public List<LedgerEntry> listEntries(UUID walletId, int limit, int offset) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE wallet_id = ? " +
            "ORDER BY sequence_number LIMIT ? OFFSET ?",
            entryRowMapper(), walletId, limit, offset);
    }

    /**
     * Re-derives the wallet's balances from its entries and puts them next to the stored ones.
     */
    @Transactional(propagation = Propagation.SUPPORTS)
    public WalletReconciliation reconcile(UUID walletId) {
        Wallet wallet = findWallet(walletId).orElseThrow(() -> NotFoundException.of("Wallet", walletId));
        return jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(available_delta), 0) AS derived_available, " +
            "COALESCE(SUM(held_delta), 0) AS derived_held, COUNT(*) AS entry_count " +
            "FROM ledger_entries WHERE wallet_id = ?",
            (rs, rowNum) -> new WalletReconciliation(
                walletId,
                wallet.getAvailableBalance(),
                wallet.getHeldBalance(),
                rs.getLong("derived_available"),
                rs.getLong("derived_held"),
                rs.getLong("entry_count")
            ),
            walletId);
    }

    /**
     * Sums every wallet per currency and compares with deposits minus withdrawals.
     */
    @Transactional(propagation = Propagation.SUPPORTS)
    public List<CurrencyTotals> currencyTotals() {
        return jdbcTemplate.query(
            "SELECT w.currency, w.total_available, w.total_held, COALESCE(e.net_external, 0) AS net_external " +
            "FROM (SELECT currency, SUM(available_balance) AS total_available, SUM(held_balance) AS total_held " +
            "      FROM wallets GROUP BY currency) w " +
            "LEFT JOIN (SELECT currency, SUM(amount) AS net_external FROM ledger_entries " +
            "           WHERE reason IN ('DEPOSIT', 'WITHDRAWAL') GROUP BY currency) e " +
            "ON e.currency = w.currency ORDER BY w.currency",
            (rs, rowNum) -> new CurrencyTotals(
                CurrencyCode.valueOf(rs.getString("currency")),
                rs.getLong("total_available"),
                rs.getLong("total_held"),
                rs.getLong("net_external")
            ));
    }

    private boolean apply(Wallet wallet, long availableDelta, long heldDelta,
                          EntryReason reason, String txnRef, String description) {
        Instant now = clock.instant();
        int inserted = jdbcTemplate.update(
            "INSERT INTO ledger_entries (id, wallet_id, amount, available_delta, held_delta, currency, reason, " +
            "txn_ref, description, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?) " +
            "ON CONFLICT (wallet_id, txn_ref, reason) DO NOTHING",
            UUID.randomUUID(), wallet.getId(), availableDelta + heldDelta, availableDelta, heldDelta,
            wallet.getCurrency().name(), reason.name(), txnRef, description, Timestamp.from(now)
        );
        if (inserted == 0) {
            alreadyApplied(wallet.getId(), txnRef, reason, availableDelta, heldDelta);
            return false;
        }

        int updated = jdbcTemplate.update(
            "UPDATE wallets SET available_balance = available_balance + ?, held_balance = held_balance + ?, " +
            "version = version + 1, updated_at = ? WHERE id = ? AND version = ?",
            availableDelta, heldDelta, Timestamp.from(now), wallet.getId(), wallet.getVersion()
        );
        if (updated != 1) {
            // Row is locked by this transaction, so a version miss means the lock was not held.
            throw new IllegalStateException("Wallet " + wallet.getId() + " changed while locked");
        }

        log.info("Ledger {} wallet={} available{} held{} ref={}",
            reason, wallet.getId(), signed(availableDelta), signed(heldDelta), txnRef);
        return true;
    }

    /**
     * True when an entry for {@code (walletId, txnRef, reason)} already exists with the same deltas.
     *
     * @throws IdempotencyConflictException if the reference was used for a different movement
     */
    private boolean alreadyApplied(UUID walletId, String txnRef, EntryReason reason,
                                   long availableDelta, long heldDelta) {
        List<LedgerEntry> existing = jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE wallet_id = ? AND txn_ref = ? AND reason = ?",
            entryRowMapper(), walletId, txnRef, reason.name());
        if (existing.isEmpty()) {
            return false;
        }
        LedgerEntry entry = existing.get(0);
        if (entry.getAvailableDelta() != availableDelta || entry.getHeldDelta() != heldDelta) {
            throw new IdempotencyConflictException(String.format(
                "Reference %s was already applied to wallet %s as %s with available%s held%s",
                txnRef, walletId, reason, signed(entry.getAvailableDelta()), signed(entry.getHeldDelta())));
        }
        return true;
    }

    private static String signed(long value) {
        return value >= 0 ? "+" + value : String.valueOf(value);
    }

    private static void requirePositive(long amount) {
        if (amount <= 0) {
            throw new InvalidAmountException("Amount must be positive, got " + amount);
        }
    }

    private static void requireDebitable(Wallet wallet) {
        if (!wallet.canBeDebited()) {
            throw new InvalidStateTransitionException(
                "Wallet " + wallet.getId() + " is " + wallet.getStatus() + " and cannot be debited");
        }
    }

    private static void requireCreditable(Wallet wallet) {
        if (!wallet.canBeCredited()) {
            throw new InvalidStateTransitionException("Wallet " + wallet.getId() + " is closed");
        }
    }

    private static void requireAvailable(Wallet wallet, long amount) {
        if (wallet.getAvailableBalance() < amount) {
            throw new InsufficientFundsException(wallet.getId(), amount, wallet.getAvailableBalance());
        }
    }

    private static void requireHeld(Wallet wallet, long amount) {
        if (wallet.getHeldBalance() < amount) {
            throw new IllegalStateException(String.format(
                "Wallet %s holds %d, cannot release %d", wallet.getId(), wallet.getHeldBalance(), amount));
        }
    }

    private RowMapper<Wallet> walletRowMapper() {
        return (rs, rowNum) -> new Wallet(
            rs.getObject("id", UUID.class),
            rs.getObject("owner_id", UUID.class),
            CurrencyCode.valueOf(rs.getString("currency")),
            WalletKind.valueOf(rs.getString("kind")),
            rs.getLong("available_balance"),
            rs.getLong("held_balance"),
            WalletStatus.valueOf(rs.getString("status")),
            rs.getLong("version"),
            rs.getTimestamp("created_at").toInstant(),
            rs.getTimestamp("updated_at").toInstant()
        );
    }

    private RowMapper<LedgerEntry> entryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            rs.getObject("id", UUID.class),
            rs.getObject("wallet_id", UUID.class),
            rs.getLong("amount"),
            rs.getLong("available_delta"),
            rs.getLong("held_delta"),
            CurrencyCode.valueOf(rs.getString("currency")),
            EntryReason.valueOf(rs.getString("reason")),
            rs.getString("txn_ref"),
            rs.getString("description"),
            rs.getTimestamp("created_at").toInstant(),
            rs.getLong("sequence_number")
        );
    }
}
