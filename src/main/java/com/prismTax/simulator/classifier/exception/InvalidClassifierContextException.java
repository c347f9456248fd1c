package com.prismTax.simulator.classifier.exception;

/**
 * Thrown when a classification request is rejected before the classifier is called.
 */
public class InvalidClassifierContextException extends RuntimeException {

    public InvalidClassifierContextException(String message) {
        super(message);
    }
}
