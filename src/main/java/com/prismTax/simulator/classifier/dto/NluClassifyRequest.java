package com.prismTax.simulator.classifier.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.prismTax.simulator.session.model.ConversationTurn;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Classification request. Used both on the wire to the NLU service and as the body of the admin testing endpoint.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NluClassifyRequest {

    @NotBlank(message = "message is required")
    @JsonProperty("message")
    private String message;

    @Builder.Default
    @JsonProperty("context")
    private List<ConversationTurn> context = new ArrayList<>();
}
