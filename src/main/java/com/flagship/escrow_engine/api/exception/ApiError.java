package com.flagship.escrow_engine.api.exception;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Error body for every failed call. {@code code} is the stable machine-readable
 * {@link com.flagship.escrow_engine.error.ErrorCode} name, absent for plain request errors.
 */
@Value
@Builder
public class ApiError {
    String error;
    String code;
    String message;
    Map<String, String> details;
    Instant timestamp;
}
