package com.prismTax.simulator.gateway.dto;

import com.prismTax.simulator.session.model.EntityType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResetRequest {

    /**
     * Entity type of the fresh session; null keeps the current one.
     */
    private EntityType entityType;
}
