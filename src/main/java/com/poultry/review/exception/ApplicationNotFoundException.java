package com.poultry.review.exception;

public class ApplicationNotFoundException extends ReviewWorkflowException {

    public ApplicationNotFoundException(String applicationId) {
        super("NOT_FOUND", "Application not found: " + applicationId);
    }
}
