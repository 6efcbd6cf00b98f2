package com.flagship.escrow_engine.api;

import com.flagship.escrow_engine.api.dto.CreateTransactionRequest;
import com.flagship.escrow_engine.api.dto.DisputeResponse;
import com.flagship.escrow_engine.api.dto.HistoryEventResponse;
import com.flagship.escrow_engine.api.dto.HoldResponse;
import com.flagship.escrow_engine.api.dto.InitiatePaymentRequest;
import com.flagship.escrow_engine.api.dto.OpenDisputeRequest;
import com.flagship.escrow_engine.api.dto.PageResponse;
import com.flagship.escrow_engine.api.dto.PaymentResponse;
import com.flagship.escrow_engine.api.dto.TransactionResponse;
import com.flagship.escrow_engine.dispute.Dispute;
import com.flagship.escrow_engine.dispute.DisputeResolver;
import com.flagship.escrow_engine.ledger.CurrencyCode;
import com.flagship.escrow_engine.transaction.ActorRole;
import com.flagship.escrow_engine.transaction.EscrowTransaction;
import com.flagship.escrow_engine.transaction.EscrowTransactionService;
import com.flagship.escrow_engine.transaction.OperationResult;
import com.flagship.escrow_engine.transaction.PartyRole;
import com.flagship.escrow_engine.transaction.PaymentResult;
import com.flagship.escrow_engine.transaction.TransactionStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST binding of the sale lifecycle.
 *
 * Identity comes from the gateway headers ({@code X-Actor-Id}, {@code X-Actor-Role}).
 * Calls with money movement accept an {@code Idempotency-Key}; paying requires one.
 * A replayed call answers 200 with the original result instead of 201.
 */
@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    private final EscrowTransactionService transactionService;
    private final DisputeResolver disputeResolver;
    private final RequestContext context;

    @PostMapping
    public ResponseEntity<TransactionResponse> create(
            @Valid @RequestBody CreateTransactionRequest request,
            @RequestHeader(RequestContext.ACTOR_ID_HEADER) UUID actorId,
            @RequestHeader(value = RequestContext.ACTOR_ROLE_HEADER, required = false) ActorRole role,
            @RequestHeader(value = RequestContext.IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @RequestHeader(value = RequestContext.TIMEOUT_HEADER, required = false) Long timeoutMs) {

        log.info("Create transaction: buyer={}, seller={}, amount={} {}",
                request.getBuyerId(), request.getSellerId(), request.getAmount(), request.getCurrency());

        OperationResult<EscrowTransaction> result = transactionService.create(
                request.getBuyerId(),
                request.getSellerId(),
                request.getListingRef(),
                request.getAmount(),
                CurrencyCode.parse(request.getCurrency()),
                context.actor(actorId, role),
                idempotencyKey,
                context.deadline(timeoutMs));

        return respond(result, TransactionResponse.from(result.getValue()));
    }

    @GetMapping("/{id}")
    public TransactionResponse get(
            @PathVariable("id") UUID id,
            @RequestHeader(RequestContext.ACTOR_ID_HEADER) UUID actorId,
            @RequestHeader(value = RequestContext.ACTOR_ROLE_HEADER, required = false) ActorRole role,
            @RequestHeader(value = RequestContext.TIMEOUT_HEADER, required = false) Long timeoutMs) {
        return TransactionResponse.from(
                transactionService.get(id, context.actor(actorId, role), context.deadline(timeoutMs)));
    }

    @GetMapping
    public PageResponse<TransactionResponse> list(
            @RequestParam("partyId") UUID partyId,
            @RequestParam(value = "role", defaultValue = "ANY") PartyRole partyRole,
            @RequestParam(value = "status", required = false) TransactionStatus status,
            @RequestParam(value = "page", defaultValue = "0") @Min(0) int page,
            @RequestParam(value = "size", defaultValue = "20") @Min(1) @Max(100) int size,
            @RequestHeader(RequestContext.ACTOR_ID_HEADER) UUID actorId,
            @RequestHeader(value = RequestContext.ACTOR_ROLE_HEADER, required = false) ActorRole role,
            @RequestHeader(value = RequestContext.TIMEOUT_HEADER, required = false) Long timeoutMs) {
        return PageResponse.from(
                transactionService.listByParty(partyId, partyRole, status, page, size,
                        context.actor(actorId, role), context.deadline(timeoutMs)),
                TransactionResponse::from);
    }

    @PostMapping("/{id}/payment")
    public ResponseEntity<PaymentResponse> initiatePayment(
            @PathVariable("id") UUID id,
            @Valid @RequestBody InitiatePaymentRequest request,
            @RequestHeader(RequestContext.ACTOR_ID_HEADER) UUID actorId,
            @RequestHeader(value = RequestContext.ACTOR_ROLE_HEADER, required = false) ActorRole role,
            @RequestHeader(RequestContext.IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
            @RequestHeader(value = RequestContext.TIMEOUT_HEADER, required = false) Long timeoutMs) {

        log.info("Initiate payment: transaction={}, wallet={}, idempotencyKey={}",
                id, request.getWalletId(), idempotencyKey);

        OperationResult<PaymentResult> result = transactionService.initiatePayment(
                id, request.getWalletId(), context.actor(actorId, role), idempotencyKey, context.deadline(timeoutMs));
        return respond(result, PaymentResponse.from(result.getValue()));
    }

    @PostMapping("/{id}/confirm-delivery")
    public ResponseEntity<TransactionResponse> confirmDelivery(
            @PathVariable("id") UUID id,
            @RequestHeader(RequestContext.ACTOR_ID_HEADER) UUID actorId,
            @RequestHeader(value = RequestContext.ACTOR_ROLE_HEADER, required = false) ActorRole role,
            @RequestHeader(value = RequestContext.IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @RequestHeader(value = RequestContext.TIMEOUT_HEADER, required = false) Long timeoutMs) {
        OperationResult<EscrowTransaction> result = transactionService.confirmDelivery(
                id, context.actor(actorId, role), idempotencyKey, context.deadline(timeoutMs));
        return ResponseEntity.ok(TransactionResponse.from(result.getValue()));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<TransactionResponse> cancel(
            @PathVariable("id") UUID id,
            @RequestHeader(RequestContext.ACTOR_ID_HEADER) UUID actorId,
            @RequestHeader(value = RequestContext.ACTOR_ROLE_HEADER, required = false) ActorRole role,
            @RequestHeader(value = RequestContext.IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @RequestHeader(value = RequestContext.TIMEOUT_HEADER, required = false) Long timeoutMs) {
        OperationResult<EscrowTransaction> result = transactionService.cancel(
                id, context.actor(actorId, role), idempotencyKey, context.deadline(timeoutMs));
        return ResponseEntity.ok(TransactionResponse.from(result.getValue()));
    }

    @GetMapping("/{id}/history")
    public List<HistoryEventResponse> history(
            @PathVariable("id") UUID id,
            @RequestHeader(RequestContext.ACTOR_ID_HEADER) UUID actorId,
            @RequestHeader(value = RequestContext.ACTOR_ROLE_HEADER, required = false) ActorRole role,
            @RequestHeader(value = RequestContext.TIMEOUT_HEADER, required = false) Long timeoutMs) {
        return transactionService.history(id, context.actor(actorId, role), context.deadline(timeoutMs))
                .stream()
                .map(HistoryEventResponse::from)
                .toList();
    }

    @GetMapping("/{id}/holds")
    public List<HoldResponse> holds(
            @PathVariable("id") UUID id,
            @RequestHeader(RequestContext.ACTOR_ID_HEADER) UUID actorId,
            @RequestHeader(value = RequestContext.ACTOR_ROLE_HEADER, required = false) ActorRole role,
            @RequestHeader(value = RequestContext.TIMEOUT_HEADER, required = false) Long timeoutMs) {
        return transactionService.holds(id, context.actor(actorId, role), context.deadline(timeoutMs))
                .stream()
                .map(HoldResponse::from)
                .toList();
    }

    @PostMapping("/{id}/disputes")
    public ResponseEntity<DisputeResponse> openDispute(
            @PathVariable("id") UUID id,
            @Valid @RequestBody OpenDisputeRequest request,
            @RequestHeader(RequestContext.ACTOR_ID_HEADER) UUID actorId,
            @RequestHeader(value = RequestContext.ACTOR_ROLE_HEADER, required = false) ActorRole role,
            @RequestHeader(value = RequestContext.IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @RequestHeader(value = RequestContext.TIMEOUT_HEADER, required = false) Long timeoutMs) {

        log.info("Open dispute: transaction={}, opener={}", id, actorId);

        OperationResult<Dispute> result = disputeResolver.open(id, context.actor(actorId, role),
                request.getReason(), request.getEvidenceRefs(), idempotencyKey, context.deadline(timeoutMs));
        return respond(result, DisputeResponse.from(result.getValue()));
    }

    private static <T> ResponseEntity<T> respond(OperationResult<?> result, T body) {
        return result.isReplayed()
                ? ResponseEntity.ok(body)
                : ResponseEntity.status(HttpStatus.CREATED).body(body);
    }
}
