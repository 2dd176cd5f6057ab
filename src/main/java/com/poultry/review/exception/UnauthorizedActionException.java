package com.poultry.review.exception;

public class UnauthorizedActionException extends ReviewWorkflowException {

    public UnauthorizedActionException(String message) {
        super("UNAUTHORIZED", message);
    }
}
