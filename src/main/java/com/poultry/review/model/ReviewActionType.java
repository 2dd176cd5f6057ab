package com.poultry.review.model;

public enum ReviewActionType {
    SUBMITTED,
    ELIGIBILITY_FAILED,
    CLAIMED,
    RELEASED,
    REASSIGNED,
    APPROVED,
    REJECTED,
    CHANGES_REQUESTED,
    RESUBMITTED,
    WITHDRAWN,
    ESCALATED,
    AUTO_REJECTED,
    DEADLINE_EXTENDED,
    // Refused decision (level mismatch or unauthorized reviewer); the application itself is unchanged
    POLICY_VIOLATION
}
