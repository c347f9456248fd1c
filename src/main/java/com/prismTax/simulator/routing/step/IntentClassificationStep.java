package com.prismTax.simulator.routing.step;

import com.prismTax.simulator.classifier.exception.InvalidClassifierContextException;
import com.prismTax.simulator.classifier.model.ClassificationResult;
import com.prismTax.simulator.classifier.service.IntentClassifierService;
import com.prismTax.simulator.emitter.service.ResponseEmitter;
import com.prismTax.simulator.gateway.model.TurnContext;
import com.prismTax.simulator.routing.IntentRouter;
import com.prismTax.simulator.routing.MessageHandlingStep;
import com.prismTax.simulator.routing.StepResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Classifies free text the grammar did not match and routes the intent.
 */
@Slf4j
@Component
@Order(40)
@RequiredArgsConstructor
public class IntentClassificationStep implements MessageHandlingStep {

    static final String THINKING_PLACEHOLDER = "🤔 Thinking...";

    private final IntentClassifierService intentClassifierService;
    private final IntentRouter intentRouter;
    private final ResponseEmitter responseEmitter;

    @Override
    public StepResult handle(TurnContext turn) {
        if (!turn.getSession().getState().isCommandZone()) {
            return StepResult.CONTINUE;
        }

        if (intentClassifierService.isRemoteEnabled()) {
            responseEmitter.processing(turn, THINKING_PLACEHOLDER);
        }

        Optional<ClassificationResult> result;
        try {
            result = intentClassifierService.classify(turn.getMessageText(),
                    List.copyOf(turn.getSession().getConversationWindow()), turn.getCorrelationId());
        } catch (InvalidClassifierContextException e) {
            log.warn("Classifier input rejected - correlationId: {}, error: {}",
                    turn.getCorrelationId(), e.getMessage());
            return StepResult.CONTINUE;
        }

        if (result.isEmpty()) {
            log.info("No intent recognized - correlationId: {}", turn.getCorrelationId());
            return StepResult.CONTINUE;
        }
        intentRouter.route(turn, result.get());
        return StepResult.HANDLED;
    }
}
