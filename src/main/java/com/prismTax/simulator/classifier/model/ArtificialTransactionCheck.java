package com.prismTax.simulator.classifier.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Classifier advisory raised when an expense looks like a personal item claimed as a business cost.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class ArtificialTransactionCheck {

    @JsonProperty("isSuspicious")
    private boolean suspicious;

    @JsonProperty("warning")
    private String warning;

    @JsonProperty("actReference")
    private String actReference;
}
