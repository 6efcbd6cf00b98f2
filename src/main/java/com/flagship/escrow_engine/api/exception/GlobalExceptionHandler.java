package com.flagship.escrow_engine.api.exception;

import com.flagship.escrow_engine.error.ErrorCode;
import com.flagship.escrow_engine.error.EscrowException;
import com.flagship.escrow_engine.error.InsufficientFundsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps engine failures to HTTP answers.
 *
 * Wrong-role and wrong-state attempts get one generic message so internal state
 * names never reach the client; the real reason is logged.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    public static final String ACTION_NOT_AVAILABLE = "This action is not available for this transaction";
    public static final String TOP_UP_WALLET = "Insufficient funds. Top up your wallet and try again.";
    static final String RETRY_AFTER_SECONDS = "1";

    @ExceptionHandler(EscrowException.class)
    public ResponseEntity<ApiError> handleEscrowException(EscrowException e) {
        ErrorCode code = e.getCode();
        HttpStatus status = statusFor(code);

        if (code == ErrorCode.STORE_UNAVAILABLE) {
            log.error("Store unavailable: {}", e.getMessage(), e);
        } else if (code == ErrorCode.DEADLINE_EXCEEDED) {
            log.warn("Deadline exceeded: {}", e.getMessage());
        } else {
            log.warn("Rejected with {}: {}", code, e.getMessage());
        }

        ApiError error = ApiError.builder()
            .error(status.getReasonPhrase())
            .code(code.name())
            .message(clientMessage(e))
            .details(details(e))
            .timestamp(Instant.now())
            .build();

        ResponseEntity.BodyBuilder response = ResponseEntity.status(status);
        if (code.isRetryable()) {
            response.header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS);
        }
        return response.body(error);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return badRequest("Missing Required Header", "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Missing required parameter: {}", e.getParameterName());
        return badRequest("Missing Required Parameter",
            "Required parameter '" + e.getParameterName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing,
                LinkedHashMap::new
            ));
        return badRequest("Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ApiError> handleMethodValidation(HandlerMethodValidationException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = new LinkedHashMap<>();
        e.getAllValidationResults().forEach(result -> errors.put(
            result.getMethodParameter().getParameterName() != null
                ? result.getMethodParameter().getParameterName()
                : "parameter" + result.getMethodParameter().getParameterIndex(),
            result.getResolvableErrors().stream()
                .map(MessageSourceResolvable::getDefaultMessage)
                .collect(Collectors.joining("; "))));
        return badRequest("Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Bad value for {}: {}", e.getName(), e.getValue());
        return badRequest("Invalid Request", "Invalid value for '" + e.getName() + "'", null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return badRequest("Invalid Request", "Request body is malformed", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return badRequest("Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ApiError error = ApiError.builder()
            .error("Internal Server Error")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    static HttpStatus statusFor(ErrorCode code) {
        return switch (code) {
            case INVALID_AMOUNT, SAME_PARTY, CURRENCY_MISMATCH -> HttpStatus.BAD_REQUEST;
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_STATE_TRANSITION, DUPLICATE_HOLD, HOLD_NOT_ACTIVE,
                 ALREADY_DISPUTED, ALREADY_RESOLVED -> HttpStatus.CONFLICT;
            case INSUFFICIENT_FUNDS, IDEMPOTENCY_CONFLICT -> HttpStatus.UNPROCESSABLE_ENTITY;
            case STORE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case DEADLINE_EXCEEDED -> HttpStatus.GATEWAY_TIMEOUT;
        };
    }

    private static String clientMessage(EscrowException e) {
        return switch (e.getCode()) {
            case FORBIDDEN, INVALID_STATE_TRANSITION -> ACTION_NOT_AVAILABLE;
            case INSUFFICIENT_FUNDS -> TOP_UP_WALLET;
            case STORE_UNAVAILABLE -> "Service temporarily unavailable, please retry";
            default -> e.getMessage();
        };
    }

    private static Map<String, String> details(EscrowException e) {
        if (e instanceof InsufficientFundsException funds) {
            Map<String, String> details = new LinkedHashMap<>();
            details.put("wallet_id", funds.getWalletId().toString());
            details.put("requested", Long.toString(funds.getRequested()));
            details.put("available", Long.toString(funds.getAvailable()));
            return details;
        }
        return null;
    }

    private static ResponseEntity<ApiError> badRequest(String error, String message, Map<String, String> details) {
        ApiError body = ApiError.builder()
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }
}
