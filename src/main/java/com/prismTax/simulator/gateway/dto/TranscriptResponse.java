package com.prismTax.simulator.gateway.dto;

import com.prismTax.simulator.emitter.model.SimulatorMessage;
import com.prismTax.simulator.session.model.CollectedProfile;
import com.prismTax.simulator.session.model.EntityType;
import com.prismTax.simulator.session.model.SessionState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TranscriptResponse {

    private String sessionId;
    private EntityType entityType;
    private SessionState state;
    private CollectedProfile profile;
    private List<SimulatorMessage> messages;
}
