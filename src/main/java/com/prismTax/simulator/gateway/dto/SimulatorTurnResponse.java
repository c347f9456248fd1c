package com.prismTax.simulator.gateway.dto;

import com.prismTax.simulator.emitter.model.SimulatorMessage;
import com.prismTax.simulator.session.model.EntityType;
import com.prismTax.simulator.session.model.SessionState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Bot messages produced by one turn, plus the session position after it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SimulatorTurnResponse {

    private String correlationId;
    private String sessionId;
    private EntityType entityType;
    private SessionState state;
    private List<SimulatorMessage> messages;
}
