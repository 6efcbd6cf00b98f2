package com.flagship.escrow_engine.transaction;

import lombok.Value;

/**
 * Result of a keyed engine call. {@code replayed} is true when the call had
 * already completed under the same idempotency key and nothing was executed again.
 */
@Value
public class OperationResult<T> {
    T value;
    boolean replayed;

    public static <T> OperationResult<T> executed(T value) {
        return new OperationResult<>(value, false);
    }

    public static <T> OperationResult<T> replayed(T value) {
        return new OperationResult<>(value, true);
    }
}
