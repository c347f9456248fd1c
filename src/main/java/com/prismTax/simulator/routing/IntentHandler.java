package com.prismTax.simulator.routing;

import com.prismTax.simulator.classifier.model.Intent;
import com.prismTax.simulator.gateway.model.TurnContext;

@FunctionalInterface
public interface IntentHandler {

    void handle(TurnContext turn, Intent intent);
}
