package com.prismTax.simulator.routing.step;

import com.prismTax.simulator.action.DocumentUploadActions;
import com.prismTax.simulator.gateway.model.TurnContext;
import com.prismTax.simulator.routing.MessageHandlingStep;
import com.prismTax.simulator.routing.StepResult;
import com.prismTax.simulator.session.model.SessionState;
import com.prismTax.simulator.session.service.RegistrationFlowService;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Runs the validator of states that expect a specific input (ID numbers, names, invoice confirmation)
 * before any grammar or classification, so structured collection is never hijacked by an intent.
 */
@Component
@Order(20)
@RequiredArgsConstructor
public class StateInputStep implements MessageHandlingStep {

    private final RegistrationFlowService registrationFlowService;
    private final DocumentUploadActions documentUploadActions;

    @Override
    public StepResult handle(TurnContext turn) {
        SessionState state = turn.getSession().getState();
        if (registrationFlowService.handles(state)) {
            registrationFlowService.handleMessage(turn);
            return StepResult.HANDLED;
        }
        if (state == SessionState.AWAITING_INVOICE_CONFIRMATION) {
            documentUploadActions.handleConfirmationReply(turn);
            return StepResult.HANDLED;
        }
        return StepResult.CONTINUE;
    }
}
