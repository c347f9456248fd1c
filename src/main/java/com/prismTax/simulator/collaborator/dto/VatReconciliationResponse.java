package com.prismTax.simulator.collaborator.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class VatReconciliationResponse {

    @JsonProperty("outputVAT")
    private BigDecimal outputVat;

    @JsonProperty("inputVAT")
    private BigDecimal inputVat;

    @JsonProperty("netVAT")
    private BigDecimal netVat;

    /**
     * Filing status, e.g. "pending", "filed", "paid".
     */
    @JsonProperty("status")
    private String status;
}
