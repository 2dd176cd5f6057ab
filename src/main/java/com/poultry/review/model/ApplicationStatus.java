package com.poultry.review.model;

public enum ApplicationStatus {
    DRAFT,
    UNDER_REVIEW,
    CHANGES_REQUESTED,
    APPROVED,
    REJECTED,
    WITHDRAWN;

    public boolean isTerminal() {
        return this == APPROVED || this == REJECTED || this == WITHDRAWN;
    }

    /**
     * Submitted and not yet decided: the application holds a review level.
     */
    public boolean isInReview() {
        return this == UNDER_REVIEW || this == CHANGES_REQUESTED;
    }
}
