package com.prismTax.simulator.gateway.dto;

import com.prismTax.simulator.session.model.EntityType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Free-text message typed into the simulator. The phone number comes from the header.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SimulatorMessageRequest {

    @NotBlank(message = "messageText cannot be blank")
    @Size(max = 4096, message = "messageText cannot exceed 4096 characters")
    private String messageText;

    /**
     * Optional; a value different from the session's entity type resets the session.
     */
    private EntityType entityType;
}
