package com.prismTax.simulator.routing.step;

import com.prismTax.simulator.emitter.service.ResponseEmitter;
import com.prismTax.simulator.emitter.template.BotMessageTemplates;
import com.prismTax.simulator.gateway.model.TurnContext;
import com.prismTax.simulator.routing.MessageHandlingStep;
import com.prismTax.simulator.routing.StepResult;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Terminal step: answers anything no earlier step handled.
 */
@Component
@Order(100)
@RequiredArgsConstructor
public class DefaultReplyStep implements MessageHandlingStep {

    private final ResponseEmitter responseEmitter;

    @Override
    public StepResult handle(TurnContext turn) {
        responseEmitter.text(turn, BotMessageTemplates.NOT_UNDERSTOOD);
        return StepResult.HANDLED;
    }
}
