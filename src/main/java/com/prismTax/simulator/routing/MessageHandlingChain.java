package com.prismTax.simulator.routing;

import com.prismTax.simulator.emitter.service.ResponseEmitter;
import com.prismTax.simulator.emitter.template.BotMessageTemplates;
import com.prismTax.simulator.gateway.model.TurnContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Ordered chain of responsibility for free-text messages:
 * reset, state input, command grammar, intent classification, default reply.
 *
 * Steps are injected sorted by {@code @Order}. The last step always answers,
 * so every message gets exactly one handling path.
 */
@Slf4j
@Service
public class MessageHandlingChain {

    private final List<MessageHandlingStep> steps;
    private final ResponseEmitter responseEmitter;

    public MessageHandlingChain(List<MessageHandlingStep> steps, ResponseEmitter responseEmitter) {
        this.steps = List.copyOf(steps);
        this.responseEmitter = responseEmitter;
        log.info("Message handling chain - steps: {}",
                this.steps.stream().map(step -> step.getClass().getSimpleName()).toList());
    }

    public void handle(TurnContext turn) {
        for (MessageHandlingStep step : steps) {
            if (step.handle(turn) == StepResult.HANDLED) {
                log.debug("Message handled - correlationId: {}, step: {}",
                        turn.getCorrelationId(), step.getClass().getSimpleName());
                return;
            }
        }
        // Unreachable while the default step is registered
        log.warn("No step handled message - correlationId: {}", turn.getCorrelationId());
        responseEmitter.text(turn, BotMessageTemplates.NOT_UNDERSTOOD);
    }
}
