package com.prismTax.simulator.emitter.service;

import com.prismTax.simulator.collaborator.exception.CollaboratorCallException;
import com.prismTax.simulator.emitter.model.ListMenu;
import com.prismTax.simulator.emitter.model.MessageSender;
import com.prismTax.simulator.emitter.model.RenderKind;
import com.prismTax.simulator.emitter.model.ReplyButton;
import com.prismTax.simulator.emitter.model.SimulatorMessage;
import com.prismTax.simulator.emitter.template.BotMessageTemplates;
import com.prismTax.simulator.gateway.model.TurnContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response emitter - turns handler decisions into transcript messages.
 *
 * Every bot message is appended to the session transcript and to the turn's
 * outgoing list in call order. Messages for a session that was reset while the
 * turn was running are dropped.
 */
@Slf4j
@Service
public class ResponseEmitter {

    /**
     * Records the inbound user message in the transcript.
     */
    public SimulatorMessage recordUserMessage(TurnContext turn, String text) {
        SimulatorMessage message = SimulatorMessage.builder()
                .id(UUID.randomUUID().toString())
                .sender(MessageSender.USER)
                .text(text)
                .renderKind(RenderKind.PLAIN)
                .timestamp(Instant.now())
                .build();
        turn.getSession().getTranscript().add(message);
        return message;
    }

    public SimulatorMessage text(TurnContext turn, String text) {
        return append(turn, SimulatorMessage.builder()
                .text(text)
                .renderKind(RenderKind.PLAIN)
                .build());
    }

    public SimulatorMessage buttons(TurnContext turn, String text, List<ReplyButton> buttons) {
        return append(turn, SimulatorMessage.builder()
                .text(text)
                .renderKind(RenderKind.BUTTON_CHOICE)
                .buttons(List.copyOf(buttons))
                .build());
    }

    public SimulatorMessage listMenu(TurnContext turn, String text, ListMenu menu) {
        return append(turn, SimulatorMessage.builder()
                .text(text)
                .renderKind(RenderKind.LIST_MENU)
                .listMenu(menu)
                .build());
    }

    /**
     * Emits the "processing..." placeholder shown while a remote call is in flight.
     */
    public SimulatorMessage processing(TurnContext turn, String text) {
        return append(turn, SimulatorMessage.builder()
                .text(text)
                .renderKind(RenderKind.PLAIN)
                .placeholder(true)
                .build());
    }

    /**
     * Emits the "failed, please try again" reply for a collaborator call.
     */
    public SimulatorMessage failure(TurnContext turn, CollaboratorCallException exception) {
        log.warn("Collaborator call failed - correlationId: {}, operation: {}, error: {}",
                turn.getCorrelationId(), exception.getOperation(), exception.getMessage());
        return text(turn, String.format(BotMessageTemplates.COLLABORATOR_FAILED, exception.getOperation()));
    }

    private SimulatorMessage append(TurnContext turn, SimulatorMessage message) {
        if (turn.isStale()) {
            log.info("Dropping message for discarded session - correlationId: {}, placeholder: {}",
                    turn.getCorrelationId(), message.isPlaceholder());
            return null;
        }

        message.setId(UUID.randomUUID().toString());
        message.setSender(MessageSender.BOT);
        message.setIntent(turn.getIntentTrace());
        message.setTimestamp(Instant.now());

        turn.getSession().getTranscript().add(message);
        turn.getOutgoing().add(message);

        log.debug("Bot message emitted - correlationId: {}, sessionId: {}, renderKind: {}, placeholder: {}",
                turn.getCorrelationId(), turn.getSession().getSessionId(),
                message.getRenderKind(), message.isPlaceholder());
        return message;
    }
}
