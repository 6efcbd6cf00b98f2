package com.flagship.escrow_engine.error;

import lombok.Getter;

/**
 * Base type for every failure the engine surfaces.
 * Subclasses exist so callers (and the exception handler) can match on type;
 * the {@link ErrorCode} is what travels over the wire.
 */
@Getter
public abstract class EscrowException extends RuntimeException {

    private final ErrorCode code;

    protected EscrowException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected EscrowException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
