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
public class VatReconciliationRequest {

    @JsonProperty("userId")
    private String userId;

    /**
     * Filing period as YYYY-MM.
     */
    @JsonProperty("period")
    private String period;
}
