package com.flagship.escrow_engine.api;

import com.flagship.escrow_engine.api.dto.DisputeResolutionResponse;
import com.flagship.escrow_engine.api.dto.DisputeResponse;
import com.flagship.escrow_engine.api.dto.ResolveDisputeRequest;
import com.flagship.escrow_engine.dispute.DisputeResolver;
import com.flagship.escrow_engine.transaction.ActorRole;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Dispute lookups and moderator resolution. Disputes are opened through
 * {@code POST /api/transactions/{id}/disputes}.
 */
@RestController
@RequestMapping("/api/disputes")
@RequiredArgsConstructor
@Slf4j
public class DisputeController {

    private final DisputeResolver disputeResolver;
    private final RequestContext context;

    @GetMapping("/{id}")
    public DisputeResponse get(
            @PathVariable("id") UUID id,
            @RequestHeader(RequestContext.ACTOR_ID_HEADER) UUID actorId,
            @RequestHeader(value = RequestContext.ACTOR_ROLE_HEADER, required = false) ActorRole role,
            @RequestHeader(value = RequestContext.TIMEOUT_HEADER, required = false) Long timeoutMs) {
        return DisputeResponse.from(
                disputeResolver.get(id, context.actor(actorId, role), context.deadline(timeoutMs)));
    }

    @PostMapping("/{id}/resolve")
    public DisputeResolutionResponse resolve(
            @PathVariable("id") UUID id,
            @Valid @RequestBody ResolveDisputeRequest request,
            @RequestHeader(RequestContext.ACTOR_ID_HEADER) UUID actorId,
            @RequestHeader(value = RequestContext.ACTOR_ROLE_HEADER, required = false) ActorRole role,
            @RequestHeader(value = RequestContext.IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @RequestHeader(value = RequestContext.TIMEOUT_HEADER, required = false) Long timeoutMs) {

        log.info("Resolve dispute: dispute={}, resolver={}, outcome={}, splitRatio={}",
                id, actorId, request.getOutcome(), request.getSplitRatio());

        return DisputeResolutionResponse.from(disputeResolver.resolve(id, context.actor(actorId, role),
                request.getOutcome(), request.getSplitRatio(), request.getNote(),
                idempotencyKey, context.deadline(timeoutMs)).getValue());
    }
}
