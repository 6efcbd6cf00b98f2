package com.flagship.escrow_engine.api;

import com.flagship.escrow_engine.config.ClockConfig;
import com.flagship.escrow_engine.dispute.Dispute;
import com.flagship.escrow_engine.dispute.DisputeOutcome;
import com.flagship.escrow_engine.dispute.DisputeResolver;
import com.flagship.escrow_engine.dispute.DisputeStatus;
import com.flagship.escrow_engine.error.AlreadyResolvedException;
import com.flagship.escrow_engine.ledger.CurrencyCode;
import com.flagship.escrow_engine.transaction.Actor;
import com.flagship.escrow_engine.transaction.ActorRole;
import com.flagship.escrow_engine.transaction.EscrowTransaction;
import com.flagship.escrow_engine.transaction.OperationResult;
import com.flagship.escrow_engine.transaction.TransactionStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DisputeController.class)
@Import({RequestContext.class, ClockConfig.class})
class DisputeControllerTest {

    private static final UUID MODERATOR = UUID.randomUUID();

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DisputeResolver disputeResolver;

    @Test
    @DisplayName("A moderator's split decision returns the dispute and the resolved sale")
    void resolveSplit() throws Exception {
        UUID disputeId = UUID.randomUUID();
        Instant now = Instant.now();
        EscrowTransaction txn = EscrowTransaction.create("listing", UUID.randomUUID(), UUID.randomUUID(),
                10_000, CurrencyCode.USD, 500, now).withStatus(TransactionStatus.RESOLVED_SPLIT, now);
        Dispute dispute = new Dispute(disputeId, txn.getId(), txn.getBuyerId(), "damaged", List.of(),
                DisputeStatus.RESOLVED_SPLIT, DisputeOutcome.SPLIT, new BigDecimal("0.5"),
                5_000L, 4_750L, 250L, "both at fault", MODERATOR, now, now, null);
        when(disputeResolver.resolve(eq(disputeId), eq(Actor.moderator(MODERATOR)), eq(DisputeOutcome.SPLIT),
                any(BigDecimal.class), eq("both at fault"), isNull(), any()))
            .thenReturn(OperationResult.executed(new DisputeResolver.Resolution(dispute, txn)));

        mockMvc.perform(post("/api/disputes/{id}/resolve", disputeId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"outcome\":\"SPLIT\",\"split_ratio\":0.5,\"note\":\"both at fault\"}")
                .header(RequestContext.ACTOR_ID_HEADER, MODERATOR)
                .header(RequestContext.ACTOR_ROLE_HEADER, ActorRole.MODERATOR.name()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.dispute.status").value("RESOLVED_SPLIT"))
            .andExpect(jsonPath("$.dispute.buyer_amount").value(5000))
            .andExpect(jsonPath("$.dispute.fee_amount").value(250))
            .andExpect(jsonPath("$.transaction.status").value("RESOLVED_SPLIT"));
    }

    @Test
    @DisplayName("Split ratios outside (0, 1) and missing outcomes are 400s")
    void resolveValidation() throws Exception {
        mockMvc.perform(post("/api/disputes/{id}/resolve", UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"outcome\":\"SPLIT\",\"split_ratio\":1.5}")
                .header(RequestContext.ACTOR_ID_HEADER, MODERATOR)
                .header(RequestContext.ACTOR_ROLE_HEADER, "MODERATOR"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.splitRatio").value("Split ratio must be less than 1"));

        mockMvc.perform(post("/api/disputes/{id}/resolve", UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"note\":\"no outcome\"}")
                .header(RequestContext.ACTOR_ID_HEADER, MODERATOR)
                .header(RequestContext.ACTOR_ROLE_HEADER, "MODERATOR"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(disputeResolver);
    }

    @Test
    @DisplayName("Deciding a resolved dispute again is a 409")
    void alreadyResolved() throws Exception {
        UUID disputeId = UUID.randomUUID();
        when(disputeResolver.resolve(eq(disputeId), any(), any(), any(), any(), any(), any()))
            .thenThrow(new AlreadyResolvedException("Dispute " + disputeId + " is already RESOLVED_BUYER"));

        mockMvc.perform(post("/api/disputes/{id}/resolve", disputeId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"outcome\":\"BUYER\"}")
                .header(RequestContext.ACTOR_ID_HEADER, MODERATOR)
                .header(RequestContext.ACTOR_ROLE_HEADER, "MODERATOR"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("ALREADY_RESOLVED"));
    }
}
