package com.flagship.escrow_engine.api;

import com.flagship.escrow_engine.api.dto.ConservationResponse;
import com.flagship.escrow_engine.api.dto.CreateWalletRequest;
import com.flagship.escrow_engine.api.dto.LedgerEntryResponse;
import com.flagship.escrow_engine.api.dto.MoneyMovementRequest;
import com.flagship.escrow_engine.api.dto.ReconciliationResponse;
import com.flagship.escrow_engine.api.dto.WalletResponse;
import com.flagship.escrow_engine.ledger.CurrencyCode;
import com.flagship.escrow_engine.ledger.WalletService;
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
 * Wallet administration and the external money movements. Called by the
 * gateway and by the payment-provider integration, not directly by end users.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class WalletController {

    private final WalletService walletService;
    private final RequestContext context;

    @PostMapping("/wallets")
    public ResponseEntity<WalletResponse> create(
            @Valid @RequestBody CreateWalletRequest request,
            @RequestHeader(value = RequestContext.TIMEOUT_HEADER, required = false) Long timeoutMs) {
        WalletResponse wallet = WalletResponse.from(walletService.createWallet(
                request.getOwnerId(), CurrencyCode.parse(request.getCurrency()), context.deadline(timeoutMs)));
        return ResponseEntity.status(HttpStatus.CREATED).body(wallet);
    }

    @GetMapping("/wallets/{id}")
    public WalletResponse get(
            @PathVariable("id") UUID id,
            @RequestHeader(value = RequestContext.TIMEOUT_HEADER, required = false) Long timeoutMs) {
        return WalletResponse.from(walletService.getWallet(id, context.deadline(timeoutMs)));
    }

    @GetMapping("/wallets")
    public List<WalletResponse> listByOwner(
            @RequestParam("ownerId") UUID ownerId,
            @RequestHeader(value = RequestContext.TIMEOUT_HEADER, required = false) Long timeoutMs) {
        return walletService.listWallets(ownerId, context.deadline(timeoutMs)).stream()
                .map(WalletResponse::from)
                .toList();
    }

    @PostMapping("/wallets/{id}/deposits")
    public WalletResponse deposit(
            @PathVariable("id") UUID id,
            @Valid @RequestBody MoneyMovementRequest request,
            @RequestHeader(value = RequestContext.TIMEOUT_HEADER, required = false) Long timeoutMs) {
        log.info("Deposit: wallet={}, amount={}, reference={}", id, request.getAmount(), request.getReference());
        return WalletResponse.from(walletService.deposit(
                id, request.getAmount(), request.getReference(), context.deadline(timeoutMs)));
    }

    @PostMapping("/wallets/{id}/withdrawals")
    public WalletResponse withdraw(
            @PathVariable("id") UUID id,
            @Valid @RequestBody MoneyMovementRequest request,
            @RequestHeader(value = RequestContext.TIMEOUT_HEADER, required = false) Long timeoutMs) {
        log.info("Withdrawal: wallet={}, amount={}, reference={}", id, request.getAmount(), request.getReference());
        return WalletResponse.from(walletService.withdraw(
                id, request.getAmount(), request.getReference(), context.deadline(timeoutMs)));
    }

    @PostMapping("/wallets/{id}/block")
    public WalletResponse block(
            @PathVariable("id") UUID id,
            @RequestHeader(value = RequestContext.TIMEOUT_HEADER, required = false) Long timeoutMs) {
        return WalletResponse.from(walletService.block(id, context.deadline(timeoutMs)));
    }

    @PostMapping("/wallets/{id}/unblock")
    public WalletResponse unblock(
            @PathVariable("id") UUID id,
            @RequestHeader(value = RequestContext.TIMEOUT_HEADER, required = false) Long timeoutMs) {
        return WalletResponse.from(walletService.unblock(id, context.deadline(timeoutMs)));
    }

    @PostMapping("/wallets/{id}/close")
    public WalletResponse close(
            @PathVariable("id") UUID id,
            @RequestHeader(value = RequestContext.TIMEOUT_HEADER, required = false) Long timeoutMs) {
        return WalletResponse.from(walletService.close(id, context.deadline(timeoutMs)));
    }

    @GetMapping("/wallets/{id}/entries")
    public List<LedgerEntryResponse> entries(
            @PathVariable("id") UUID id,
            @RequestParam(value = "page", defaultValue = "0") @Min(0) int page,
            @RequestParam(value = "size", defaultValue = "50") @Min(1) @Max(500) int size,
            @RequestHeader(value = RequestContext.TIMEOUT_HEADER, required = false) Long timeoutMs) {
        return walletService.listEntries(id, page, size, context.deadline(timeoutMs)).stream()
                .map(LedgerEntryResponse::from)
                .toList();
    }

    @GetMapping("/wallets/{id}/reconciliation")
    public ReconciliationResponse reconcile(
            @PathVariable("id") UUID id,
            @RequestHeader(value = RequestContext.TIMEOUT_HEADER, required = false) Long timeoutMs) {
        return ReconciliationResponse.from(walletService.reconcile(id, context.deadline(timeoutMs)));
    }

    @GetMapping("/ledger/conservation")
    public ConservationResponse conservation(
            @RequestHeader(value = RequestContext.TIMEOUT_HEADER, required = false) Long timeoutMs) {
        return ConservationResponse.from(walletService.checkConservation(context.deadline(timeoutMs)));
    }
}
