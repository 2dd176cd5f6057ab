package com.poultry.review.integration;

public enum NotificationEvent {
    APPLICATION_SUBMITTED,
    ELIGIBILITY_FAILED,
    APPLICATION_ADVANCED,
    APPLICATION_APPROVED,
    APPLICATION_REJECTED,
    CHANGES_REQUESTED,
    APPLICATION_RESUBMITTED,
    APPLICATION_WITHDRAWN,
    CHANGES_DEADLINE_EXPIRED,
    CHANGES_DEADLINE_EXTENDED,
    QUEUE_ENTRY_ESCALATED
}
