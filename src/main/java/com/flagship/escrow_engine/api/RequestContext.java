package com.flagship.escrow_engine.api;

import com.flagship.escrow_engine.persistence.Deadline;
import com.flagship.escrow_engine.transaction.Actor;
import com.flagship.escrow_engine.transaction.ActorRole;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

/**
 * Turns the gateway's identity and timeout headers into the explicit
 * {@link Actor} and {@link Deadline} every engine call takes.
 */
@Component
public class RequestContext {

    public static final String ACTOR_ID_HEADER = "X-Actor-Id";
    public static final String ACTOR_ROLE_HEADER = "X-Actor-Role";
    public static final String TIMEOUT_HEADER = "X-Request-Timeout-Ms";
    public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private static final long MAX_TIMEOUT_MS = 60_000;

    private final Clock clock;
    private final long defaultTimeoutMs;

    public RequestContext(Clock clock,
                          @Value("${escrow.request.default-timeout-ms:5000}") long defaultTimeoutMs) {
        this.clock = clock;
        this.defaultTimeoutMs = defaultTimeoutMs;
    }

    public Actor actor(UUID actorId, ActorRole role) {
        if (role == null) {
            role = ActorRole.USER;
        }
        return switch (role) {
            case USER -> Actor.user(actorId);
            case MODERATOR -> Actor.moderator(actorId);
            case SYSTEM -> Actor.system();
        };
    }

    /**
     * @param timeoutMs caller's budget; the configured default when absent, capped at one minute
     */
    public Deadline deadline(Long timeoutMs) {
        long millis = timeoutMs != null ? timeoutMs : defaultTimeoutMs;
        if (millis <= 0) {
            throw new IllegalArgumentException(TIMEOUT_HEADER + " must be positive");
        }
        return Deadline.after(Duration.ofMillis(Math.min(millis, MAX_TIMEOUT_MS)), clock);
    }
}
