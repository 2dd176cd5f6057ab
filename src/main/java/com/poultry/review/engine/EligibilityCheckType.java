package com.poultry.review.engine;

/**
 * Eligibility checks in the order they are applied. Flags are reported in this order.
 */
public enum EligibilityCheckType {
    PROGRAM_TRACK,
    MANDATORY_DOCUMENTS,
    AGE_RANGE,
    SUBMISSION_DEADLINE,
    PROGRAM_CAPACITY,
    CONSTITUENCY,
    BIRD_CAPACITY,
    EXISTING_BENEFICIARY
}
