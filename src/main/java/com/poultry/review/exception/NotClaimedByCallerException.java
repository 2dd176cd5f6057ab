package com.poultry.review.exception;

public class NotClaimedByCallerException extends ReviewWorkflowException {

    public NotClaimedByCallerException(String entryId, String callerId) {
        super("NOT_CLAIMED_BY_CALLER",
                String.format("Queue entry %s is not claimed by %s", entryId, callerId));
    }

    public NotClaimedByCallerException(String message) {
        super("NOT_CLAIMED_BY_CALLER", message);
    }
}
