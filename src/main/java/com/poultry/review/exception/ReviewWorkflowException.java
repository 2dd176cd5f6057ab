package com.poultry.review.exception;

import lombok.Getter;

/**
 * Base class of every failure raised by the review workflow.
 * Carries a stable error code for API clients.
 */
@Getter
public abstract class ReviewWorkflowException extends RuntimeException {

    private final String errorCode;

    protected ReviewWorkflowException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
