package com.poultry.review.exception;

/**
 * The record kept changing underneath the caller and the retry budget ran out.
 * Safe to retry after refreshing.
 */
public class ConcurrentUpdateException extends ReviewWorkflowException {

    public ConcurrentUpdateException(String applicationId, int attempts) {
        super("CONCURRENT_UPDATE",
                String.format("Application %s was modified concurrently; gave up after %d attempts", applicationId, attempts));
    }
}
