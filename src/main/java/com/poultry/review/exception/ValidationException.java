package com.poultry.review.exception;

/**
 * Missing or malformed submission fields. Results in HTTP 400.
 */
public class ValidationException extends ReviewWorkflowException {

    public ValidationException(String message) {
        super("VALIDATION_ERROR", message);
    }
}
