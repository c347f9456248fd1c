package com.prismTax.simulator.collaborator.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Result of the remote VAT calculator. Values are relayed to the user as returned.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class VatCalculationResponse {

    /**
     * Supply classification, e.g. "standard", "zero-rated", "exempt".
     */
    @JsonProperty("classification")
    private String classification;

    @JsonProperty("actReference")
    private String actReference;

    @JsonProperty("subtotal")
    private BigDecimal subtotal;

    /**
     * Rate as a fraction, e.g. 0.075.
     */
    @JsonProperty("vatRate")
    private BigDecimal vatRate;

    @JsonProperty("vatAmount")
    private BigDecimal vatAmount;

    @JsonProperty("total")
    private BigDecimal total;

    @JsonProperty("canClaimInputVAT")
    private Boolean canClaimInputVat;
}
