package com.prismTax.simulator.gateway.dto;

import com.prismTax.simulator.collaborator.dto.DocumentType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Document image uploaded through the simulator, base64 encoded.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UploadRequest {

    @NotNull(message = "documentType is required")
    private DocumentType documentType;

    private String fileName;

    @NotBlank(message = "imageBase64 cannot be blank")
    private String imageBase64;
}
