package com.prismTax.simulator.routing;

import com.prismTax.simulator.gateway.model.TurnContext;

/**
 * One link of the free-text message chain. Steps run in {@code @Order} order.
 */
public interface MessageHandlingStep {

    StepResult handle(TurnContext turn);
}
