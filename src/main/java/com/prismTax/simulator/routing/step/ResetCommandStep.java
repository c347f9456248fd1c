package com.prismTax.simulator.routing.step;

import com.prismTax.simulator.emitter.service.ResponseEmitter;
import com.prismTax.simulator.emitter.template.BotMessageTemplates;
import com.prismTax.simulator.gateway.model.TurnContext;
import com.prismTax.simulator.routing.MessageHandlingStep;
import com.prismTax.simulator.routing.StepResult;
import com.prismTax.simulator.session.model.SimulatorSession;
import com.prismTax.simulator.session.service.SessionService;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * "reset" / "restart" from any state: replaces the session with a fresh one in state NEW.
 *
 * The reset reply is written into the fresh session under its turn lock, since a turn queued
 * on the fresh session may already be running.
 */
@Component
@Order(10)
@RequiredArgsConstructor
public class ResetCommandStep implements MessageHandlingStep {

    private static final Set<String> RESET_COMMANDS = Set.of("reset", "restart", "/reset", "/restart");

    private final SessionService sessionService;
    private final ResponseEmitter responseEmitter;

    @Override
    public StepResult handle(TurnContext turn) {
        if (!RESET_COMMANDS.contains(turn.normalizedText())) {
            return StepResult.CONTINUE;
        }
        SimulatorSession fresh = sessionService.resetSession(turn.getPhoneNumber(), null);
        fresh.getTurnLock().lock();
        try {
            turn.setSession(fresh);
            responseEmitter.text(turn, BotMessageTemplates.SESSION_RESET);
        } finally {
            fresh.getTurnLock().unlock();
        }
        return StepResult.HANDLED;
    }
}
