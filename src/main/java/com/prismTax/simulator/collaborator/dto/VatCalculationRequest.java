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
public class VatCalculationRequest {

    @JsonProperty("amount")
    private long amount;

    @JsonProperty("itemDescription")
    private String itemDescription;
}
