package com.flagship.escrow_engine.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local context for correlation ID propagation, plus the MDC keys
 * engine calls attach to their log lines.
 *
 * The correlation ID flows from the HTTP header into every log statement
 * and into the outbox events written while serving the request.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String TRANSACTION_ID_MDC_KEY = "transactionId";
    public static final String WALLET_ID_MDC_KEY = "walletId";
    public static final String DISPUTE_ID_MDC_KEY = "disputeId";
    public static final String ACTOR_MDC_KEY = "actor";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Gets the current correlation ID, or generates a new one if not set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }

    /**
     * Puts an id in the MDC for the lifetime of the returned handle.
     * Usage: {@code try (MDC.MDCCloseable ignored = CorrelationContext.withId(KEY, id)) { ... }}
     */
    public static MDC.MDCCloseable withId(String key, Object id) {
        return MDC.putCloseable(key, String.valueOf(id));
    }
}
