package com.poultry.review.exception;

/**
 * The requested transition is not allowed from the application's current status.
 */
public class InvalidStateException extends ReviewWorkflowException {

    public InvalidStateException(String message) {
        super("INVALID_STATE", message);
    }
}
