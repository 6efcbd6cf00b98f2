package com.flagship.escrow_engine.transaction;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a sale, with its full transition table.
 *
 * <pre>
 * PENDING -> PAYMENT_PROCESSING -> ESCROW_HELD -> COMPLETED
 *    |              |    |              |   \
 *    v              v    v              v    -> REFUNDED
 * CANCELED <--------+  DISPUTED <-------+
 *                          |
 *                          v
 *        RESOLVED_BUYER | RESOLVED_SELLER | RESOLVED_SPLIT
 * </pre>
 *
 * PAYMENT_PROCESSING -> PENDING is the rollback taken when the hold cannot be funded.
 */
public enum TransactionStatus {
    /** Created, no money touched yet. */
    PENDING,
    /** Payment started; the hold is being placed. */
    PAYMENT_PROCESSING,
    /** Buyer funds are held in escrow. */
    ESCROW_HELD,
    /** Terminal: delivery confirmed, hold captured to the seller. */
    COMPLETED,
    /** Terminal: abandoned before any hold existed. */
    CANCELED,
    /** Terminal: hold returned to the buyer on timeout. */
    REFUNDED,
    /** A dispute is open; only a moderator decision moves it on. */
    DISPUTED,
    /** Terminal: dispute decided for the buyer. */
    RESOLVED_BUYER,
    /** Terminal: dispute decided for the seller. */
    RESOLVED_SELLER,
    /** Terminal: dispute decided with a split. */
    RESOLVED_SPLIT;

    private static final Map<TransactionStatus, Set<TransactionStatus>> ALLOWED_TRANSITIONS =
        new EnumMap<>(TransactionStatus.class);

    static {
        ALLOWED_TRANSITIONS.put(PENDING, EnumSet.of(PAYMENT_PROCESSING, CANCELED));
        ALLOWED_TRANSITIONS.put(PAYMENT_PROCESSING, EnumSet.of(ESCROW_HELD, PENDING, CANCELED, DISPUTED));
        ALLOWED_TRANSITIONS.put(ESCROW_HELD, EnumSet.of(COMPLETED, REFUNDED, DISPUTED));
        ALLOWED_TRANSITIONS.put(DISPUTED, EnumSet.of(RESOLVED_BUYER, RESOLVED_SELLER, RESOLVED_SPLIT));
        for (TransactionStatus status : values()) {
            ALLOWED_TRANSITIONS.putIfAbsent(status, EnumSet.noneOf(TransactionStatus.class));
        }
    }

    public boolean canTransitionTo(TransactionStatus target) {
        return ALLOWED_TRANSITIONS.get(this).contains(target);
    }

    public Set<TransactionStatus> allowedTargets() {
        return Collections.unmodifiableSet(ALLOWED_TRANSITIONS.get(this));
    }

    public boolean isTerminal() {
        return ALLOWED_TRANSITIONS.get(this).isEmpty();
    }
}
