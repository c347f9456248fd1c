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
public class DocumentOcrRequest {

    /**
     * Base64-encoded image.
     */
    @JsonProperty("image")
    private String image;

    @JsonProperty("documentType")
    private DocumentType documentType;
}
