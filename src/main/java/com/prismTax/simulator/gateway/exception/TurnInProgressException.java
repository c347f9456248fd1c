package com.prismTax.simulator.gateway.exception;

/**
 * Exception thrown when a turn waited too long for the previous turn of the same session.
 */
public class TurnInProgressException extends RuntimeException {

    public TurnInProgressException(String message) {
        super(message);
    }
}
