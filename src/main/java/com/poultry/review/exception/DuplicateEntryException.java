package com.poultry.review.exception;

/**
 * A live queue entry already exists for the application at that level.
 */
public class DuplicateEntryException extends ReviewWorkflowException {

    public DuplicateEntryException(String applicationId, int level) {
        super("DUPLICATE_ENTRY",
                String.format("Application %s already has a live queue entry at level %d", applicationId, level));
    }
}
