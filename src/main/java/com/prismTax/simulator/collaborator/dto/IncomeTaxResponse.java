package com.prismTax.simulator.collaborator.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class IncomeTaxResponse {

    @JsonProperty("taxBreakdown")
    private List<BandTax> taxBreakdown;

    @JsonProperty("totalTax")
    private BigDecimal totalTax;

    /**
     * Effective rate in percent, e.g. 12.4.
     */
    @JsonProperty("effectiveRate")
    private BigDecimal effectiveRate;

    @JsonProperty("monthlyTax")
    private BigDecimal monthlyTax;

    @JsonProperty("isMinimumWageExempt")
    private Boolean minimumWageExempt;

    @JsonProperty("isPensionExempt")
    private Boolean pensionExempt;

    @JsonProperty("actReference")
    private String actReference;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BandTax {

        /**
         * Human-readable band label, e.g. "Next ₦1,600,000".
         */
        @JsonProperty("band")
        private String band;

        /**
         * Rate as a fraction, e.g. 0.15.
         */
        @JsonProperty("rate")
        private BigDecimal rate;

        @JsonProperty("taxInBand")
        private BigDecimal taxInBand;
    }
}
