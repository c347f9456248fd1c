package com.prismTax.simulator.classifier.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.prismTax.simulator.classifier.model.ArtificialTransactionCheck;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class NluClassifyResponse {

    @JsonProperty("intent")
    private IntentPayload intent;

    @JsonProperty("source")
    private String source;

    @JsonProperty("artificialTransactionCheck")
    private ArtificialTransactionCheck artificialTransactionCheck;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IntentPayload {

        @JsonProperty("name")
        private String name;

        @JsonProperty("confidence")
        private Double confidence;

        @JsonProperty("entities")
        private Map<String, Object> entities;

        @JsonProperty("reasoning")
        private String reasoning;
    }
}
