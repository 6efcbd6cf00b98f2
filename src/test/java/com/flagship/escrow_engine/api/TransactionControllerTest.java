package com.flagship.escrow_engine.api;

import com.flagship.escrow_engine.api.exception.GlobalExceptionHandler;
import com.flagship.escrow_engine.config.ClockConfig;
import com.flagship.escrow_engine.dispute.DisputeResolver;
import com.flagship.escrow_engine.error.ForbiddenException;
import com.flagship.escrow_engine.error.InsufficientFundsException;
import com.flagship.escrow_engine.error.InvalidStateTransitionException;
import com.flagship.escrow_engine.error.NotFoundException;
import com.flagship.escrow_engine.error.StoreUnavailableException;
import com.flagship.escrow_engine.hold.Hold;
import com.flagship.escrow_engine.hold.HoldStatus;
import com.flagship.escrow_engine.ledger.CurrencyCode;
import com.flagship.escrow_engine.persistence.Deadline;
import com.flagship.escrow_engine.transaction.Actor;
import com.flagship.escrow_engine.transaction.EscrowTransaction;
import com.flagship.escrow_engine.transaction.EscrowTransactionService;
import com.flagship.escrow_engine.transaction.OperationResult;
import com.flagship.escrow_engine.transaction.PaymentResult;
import com.flagship.escrow_engine.transaction.TransactionStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.UUID;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TransactionController.class)
@Import({RequestContext.class, ClockConfig.class})
class TransactionControllerTest {

    private static final UUID BUYER = UUID.randomUUID();
    private static final UUID SELLER = UUID.randomUUID();

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private EscrowTransactionService transactionService;

    @MockBean
    private DisputeResolver disputeResolver;

    @Test
    @DisplayName("Create answers 201, and 200 when the key replays an earlier create")
    void createAndReplay() throws Exception {
        EscrowTransaction txn = sale(TransactionStatus.PENDING);
        when(transactionService.create(eq(BUYER), eq(SELLER), eq("listing-9"), eq(8_000L), eq(CurrencyCode.USD),
                any(Actor.class), eq("key-1"), any(Deadline.class)))
            .thenReturn(OperationResult.executed(txn))
            .thenReturn(OperationResult.replayed(txn));

        String body = """
            {"buyer_id":"%s","seller_id":"%s","listing_ref":"listing-9","amount":8000,"currency":"USD"}
            """.formatted(BUYER, SELLER);

        mockMvc.perform(post("/api/transactions").contentType(MediaType.APPLICATION_JSON).content(body)
                .header(RequestContext.ACTOR_ID_HEADER, BUYER)
                .header(RequestContext.IDEMPOTENCY_KEY_HEADER, "key-1"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value(txn.getId().toString()))
            .andExpect(jsonPath("$.status").value("PENDING"))
            .andExpect(jsonPath("$.fee_amount").value(400));

        mockMvc.perform(post("/api/transactions").contentType(MediaType.APPLICATION_JSON).content(body)
                .header(RequestContext.ACTOR_ID_HEADER, BUYER)
                .header(RequestContext.IDEMPOTENCY_KEY_HEADER, "key-1"))
            .andExpect(status().isOk());

        ArgumentCaptor<Actor> actor = ArgumentCaptor.forClass(Actor.class);
        verify(transactionService, times(2)).create(any(), any(), any(), anyLong(), any(), actor.capture(), any(), any());
        assertEquals(Actor.user(BUYER), actor.getValue());
    }

    @Test
    @DisplayName("Invalid create bodies are rejected before reaching the engine")
    void createValidation() throws Exception {
        mockMvc.perform(post("/api/transactions").contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"buyer_id":"%s","seller_id":"%s","listing_ref":"x","amount":-5,"currency":"usd"}
                    """.formatted(BUYER, SELLER))
                .header(RequestContext.ACTOR_ID_HEADER, BUYER))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.amount").value("Amount must be greater than 0"))
            .andExpect(jsonPath("$.details.currency").exists());

        verifyNoInteractions(transactionService);
    }

    @Test
    @DisplayName("Paying without an Idempotency-Key is a 400")
    void paymentNeedsKey() throws Exception {
        mockMvc.perform(post("/api/transactions/{id}/payment", UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"wallet_id\":\"" + UUID.randomUUID() + "\"}")
                .header(RequestContext.ACTOR_ID_HEADER, BUYER))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message", containsString(RequestContext.IDEMPOTENCY_KEY_HEADER)));

        verifyNoInteractions(transactionService);
    }

    @Test
    @DisplayName("A successful payment returns the held sale and its hold")
    void paymentSucceeds() throws Exception {
        EscrowTransaction txn = sale(TransactionStatus.ESCROW_HELD);
        UUID walletId = UUID.randomUUID();
        Hold hold = new Hold(UUID.randomUUID(), walletId, txn.getId(), 8_000, 0, 0, CurrencyCode.USD,
            HoldStatus.ACTIVE, Instant.now(), Instant.now().plusSeconds(3600), null);
        when(transactionService.initiatePayment(eq(txn.getId()), eq(walletId), any(), eq("pay-1"), any()))
            .thenReturn(OperationResult.executed(new PaymentResult(txn, hold)));

        mockMvc.perform(post("/api/transactions/{id}/payment", txn.getId())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"wallet_id\":\"" + walletId + "\"}")
                .header(RequestContext.ACTOR_ID_HEADER, BUYER)
                .header(RequestContext.IDEMPOTENCY_KEY_HEADER, "pay-1"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.transaction.status").value("ESCROW_HELD"))
            .andExpect(jsonPath("$.hold.status").value("ACTIVE"));
    }

    @Test
    @DisplayName("Insufficient funds is a 422 telling the buyer to top up, with the numbers in details")
    void insufficientFunds() throws Exception {
        UUID walletId = UUID.randomUUID();
        when(transactionService.initiatePayment(any(), any(), any(), anyString(), any()))
            .thenThrow(new InsufficientFundsException(walletId, 8_000, 500));

        mockMvc.perform(post("/api/transactions/{id}/payment", UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"wallet_id\":\"" + walletId + "\"}")
                .header(RequestContext.ACTOR_ID_HEADER, BUYER)
                .header(RequestContext.IDEMPOTENCY_KEY_HEADER, "pay-2"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.code").value("INSUFFICIENT_FUNDS"))
            .andExpect(jsonPath("$.message").value(GlobalExceptionHandler.TOP_UP_WALLET))
            .andExpect(jsonPath("$.details.requested").value("8000"))
            .andExpect(jsonPath("$.details.available").value("500"));
    }

    @Test
    @DisplayName("Forbidden and invalid transitions share one generic message")
    void genericRejectionMessages() throws Exception {
        UUID id = UUID.randomUUID();
        when(transactionService.confirmDelivery(eq(id), any(), isNull(), any()))
            .thenThrow(new ForbiddenException("Only the buyer may confirm delivery"));
        when(transactionService.cancel(eq(id), any(), isNull(), any()))
            .thenThrow(new InvalidStateTransitionException(TransactionStatus.ESCROW_HELD, TransactionStatus.CANCELED));

        mockMvc.perform(post("/api/transactions/{id}/confirm-delivery", id)
                .header(RequestContext.ACTOR_ID_HEADER, SELLER))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.message").value(GlobalExceptionHandler.ACTION_NOT_AVAILABLE));

        mockMvc.perform(post("/api/transactions/{id}/cancel", id)
                .header(RequestContext.ACTOR_ID_HEADER, BUYER))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("INVALID_STATE_TRANSITION"))
            .andExpect(jsonPath("$.message").value(GlobalExceptionHandler.ACTION_NOT_AVAILABLE));
    }

    @Test
    @DisplayName("Store outages are a retryable 503")
    void storeUnavailable() throws Exception {
        UUID id = UUID.randomUUID();
        when(transactionService.get(eq(id), any(), any()))
            .thenThrow(new StoreUnavailableException("pool exhausted", null));

        mockMvc.perform(get("/api/transactions/{id}", id).header(RequestContext.ACTOR_ID_HEADER, BUYER))
            .andExpect(status().isServiceUnavailable())
            .andExpect(header().string("Retry-After", "1"));
    }

    @Test
    @DisplayName("Missing sales are 404; bad ids, headers and timeouts are 400")
    void requestErrors() throws Exception {
        UUID id = UUID.randomUUID();
        when(transactionService.get(eq(id), any(), any())).thenThrow(NotFoundException.of("Transaction", id));

        mockMvc.perform(get("/api/transactions/{id}", id).header(RequestContext.ACTOR_ID_HEADER, BUYER))
            .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/transactions/{id}", "not-a-uuid").header(RequestContext.ACTOR_ID_HEADER, BUYER))
            .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/transactions/{id}", id))
            .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/transactions/{id}", id)
                .header(RequestContext.ACTOR_ID_HEADER, BUYER)
                .header(RequestContext.TIMEOUT_HEADER, "0"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Page size above the limit is rejected")
    void listPageLimits() throws Exception {
        mockMvc.perform(get("/api/transactions")
                .param("partyId", BUYER.toString())
                .param("size", "500")
                .header(RequestContext.ACTOR_ID_HEADER, BUYER))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(transactionService);
    }

    private static EscrowTransaction sale(TransactionStatus status) {
        Instant now = Instant.now();
        return EscrowTransaction.create("listing-9", BUYER, SELLER, 8_000, CurrencyCode.USD, 400, now)
            .withStatus(status, now);
    }
}
