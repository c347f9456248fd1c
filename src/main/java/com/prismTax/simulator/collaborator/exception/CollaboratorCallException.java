package com.prismTax.simulator.collaborator.exception;

/**
 * Raised when a remote collaborator (tax calculator, OCR, project funds, NLU)
 * returns a non-2xx status, an empty body, or cannot be reached.
 *
 * {@link #getOperation()} is a user-facing label such as "VAT calculation",
 * used to build the "failed, please try again" reply.
 */
public class CollaboratorCallException extends RuntimeException {

    private final String operation;

    public CollaboratorCallException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public CollaboratorCallException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
