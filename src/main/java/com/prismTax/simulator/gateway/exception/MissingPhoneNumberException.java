package com.prismTax.simulator.gateway.exception;

/**
 * Exception thrown when the X-Simulator-Phone header is missing.
 */
public class MissingPhoneNumberException extends RuntimeException {

    public MissingPhoneNumberException(String message) {
        super(message);
    }
}
