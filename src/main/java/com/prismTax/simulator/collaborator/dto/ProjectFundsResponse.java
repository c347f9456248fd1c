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
public class ProjectFundsResponse {

    @JsonProperty("projectId")
    private String projectId;

    @JsonProperty("budget")
    private BigDecimal budget;

    @JsonProperty("spent")
    private BigDecimal spent;

    @JsonProperty("excess")
    private BigDecimal excess;

    @JsonProperty("tax")
    private BigDecimal tax;

    @JsonProperty("status")
    private String status;
}
