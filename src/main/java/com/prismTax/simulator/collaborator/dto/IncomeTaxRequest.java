package com.prismTax.simulator.collaborator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IncomeTaxRequest {

    public static final String PERIOD_ANNUAL = "annual";
    public static final String PERIOD_MONTHLY = "monthly";

    @JsonProperty("grossIncome")
    private long grossIncome;

    /**
     * "annual" or "monthly".
     */
    @JsonProperty("period")
    private String period;

    /**
     * employment, pension, business or mixed.
     */
    @JsonProperty("incomeType")
    private String incomeType;

    @JsonProperty("pensionAmount")
    private long pensionAmount;

    @JsonProperty("deductions")
    private Deductions deductions;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Deductions {

        @JsonProperty("businessExpenses")
        private long businessExpenses;

        @JsonProperty("equipmentCosts")
        private long equipmentCosts;
    }
}
