package com.flagship.escrow_engine.error;

import lombok.Getter;

/**
 * A transition was attempted from a state that does not allow it.
 * Reported to the caller, never retried.
 */
@Getter
public class InvalidStateTransitionException extends EscrowException {

    private final String fromState;
    private final String toState;

    public InvalidStateTransitionException(String message) {
        super(ErrorCode.INVALID_STATE_TRANSITION, message);
        this.fromState = null;
        this.toState = null;
    }

    public InvalidStateTransitionException(Enum<?> from, Enum<?> to) {
        super(ErrorCode.INVALID_STATE_TRANSITION, String.format("Transition %s -> %s is not allowed", from, to));
        this.fromState = from.name();
        this.toState = to.name();
    }
}
