package com.poultry.review.model;

/**
 * What happens when an applicant lets a change request lapse.
 */
public enum ExpiryPolicy {
    AUTO_REJECT,
    ESCALATE
}
