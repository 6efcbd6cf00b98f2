package com.flagship.escrow_engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escrow_engine.ledger.CurrencyTotals;
import lombok.Value;

import java.util.List;

/**
 * Per-currency check that wallets hold exactly what came in minus what went out.
 */
@Value
public class ConservationResponse {

    @JsonProperty("conserved")
    boolean conserved;

    @JsonProperty("currencies")
    List<Line> currencies;

    public static ConservationResponse from(List<CurrencyTotals> totals) {
        List<Line> lines = totals.stream()
            .map(t -> new Line(t.getCurrency().name(), t.getTotalAvailable(), t.getTotalHeld(),
                t.getNetExternalFlow(), t.isConserved()))
            .toList();
        return new ConservationResponse(lines.stream().allMatch(Line::isConserved), lines);
    }

    @Value
    public static class Line {
        @JsonProperty("currency")
        String currency;

        @JsonProperty("total_available")
        long totalAvailable;

        @JsonProperty("total_held")
        long totalHeld;

        @JsonProperty("net_external_flow")
        long netExternalFlow;

        @JsonProperty("conserved")
        boolean conserved;
    }
}
