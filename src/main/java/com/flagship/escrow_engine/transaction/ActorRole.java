package com.flagship.escrow_engine.transaction;

public enum ActorRole {
    USER,
    MODERATOR,
    SYSTEM
}
