package com.poultry.review.exception;

public class QueueEntryNotFoundException extends ReviewWorkflowException {

    public QueueEntryNotFoundException(String entryId) {
        super("NOT_FOUND", "Queue entry not found: " + entryId);
    }
}
