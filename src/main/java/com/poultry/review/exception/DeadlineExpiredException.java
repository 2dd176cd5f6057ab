package com.poultry.review.exception;

/**
 * Raised inside the engine when a resubmission arrives after its deadline.
 * Never reaches API callers; it triggers the automatic rejection instead.
 */
public class DeadlineExpiredException extends ReviewWorkflowException {

    public DeadlineExpiredException(String applicationId, long deadline) {
        super("DEADLINE_EXPIRED",
                String.format("Changes deadline for application %s passed at %d", applicationId, deadline));
    }
}
