package com.prismTax.simulator.routing;

/**
 * Outcome of one message handling step.
 */
public enum StepResult {
    /** The step answered the message; later steps are skipped. */
    HANDLED,
    /** The step did not apply; the next step runs. */
    CONTINUE
}
