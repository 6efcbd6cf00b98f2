package com.flagship.escrow_engine.transaction;

import lombok.Value;

import java.util.Objects;
import java.util.UUID;

/**
 * Who is calling the engine. Passed explicitly into every operation; the engine
 * keeps no session state.
 */
@Value
public class Actor {

    /** Id recorded for automated transitions (sweeper, recovery). */
    public static final UUID SYSTEM_ID = new UUID(0L, 0L);

    private static final Actor SYSTEM = new Actor(SYSTEM_ID, ActorRole.SYSTEM);

    UUID id;
    ActorRole role;

    public static Actor user(UUID id) {
        return new Actor(Objects.requireNonNull(id, "id"), ActorRole.USER);
    }

    public static Actor moderator(UUID id) {
        return new Actor(Objects.requireNonNull(id, "id"), ActorRole.MODERATOR);
    }

    public static Actor system() {
        return SYSTEM;
    }

    public boolean isSystem() {
        return role == ActorRole.SYSTEM;
    }

    public boolean isModerator() {
        return role == ActorRole.MODERATOR;
    }

    public boolean is(UUID userId) {
        return id.equals(userId);
    }
}
