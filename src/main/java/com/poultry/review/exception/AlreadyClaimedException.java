package com.poultry.review.exception;

public class AlreadyClaimedException extends ReviewWorkflowException {

    public AlreadyClaimedException(String entryId, String assignedTo) {
        super("ALREADY_CLAIMED",
                String.format("Queue entry %s is not pending (held by %s)", entryId, assignedTo));
    }
}
