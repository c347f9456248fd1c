package com.prismTax.simulator.gateway.model;

import com.prismTax.simulator.emitter.model.IntentTrace;
import com.prismTax.simulator.emitter.model.SimulatorMessage;
import com.prismTax.simulator.session.model.SimulatorSession;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turn context passed through the handling pipeline.
 * Carries the single session this turn is allowed to mutate and collects the bot messages it emits.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TurnContext {

    /**
     * Correlation ID for request tracking and audit.
     */
    private String correlationId;

    /**
     * Simulated phone number from the X-Simulator-Phone header.
     */
    private String phoneNumber;

    /**
     * Session owned by this turn.
     */
    private SimulatorSession session;

    /**
     * Raw text of the inbound message; for button turns, the button ID.
     */
    private String messageText;

    /**
     * Intent that drove the current reply, attached to emitted messages for traceability.
     */
    private IntentTrace intentTrace;

    /**
     * Bot messages emitted during this turn, in emission order.
     */
    @Builder.Default
    private List<SimulatorMessage> outgoing = new ArrayList<>();

    /**
     * Timestamp when the turn was accepted at the gateway.
     */
    private Instant receivedAt;

    /**
     * True once the session was replaced by a reset while this turn was running.
     */
    public boolean isStale() {
        return session == null || session.isDiscarded();
    }

    /**
     * Text of the inbound message, trimmed and lower-cased; empty string when absent.
     */
    public String normalizedText() {
        if (messageText == null) {
            return "";
        }
        return messageText.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
