package com.poultry.review.model;

public enum ReviewerRole {
    CONSTITUENCY_OFFICER,
    REGIONAL_OFFICER,
    NATIONAL_OFFICER,
    SUPERVISOR,
    ADMIN;

    /**
     * Supervisory roles may reassign queue entries and decide entries claimed by others.
     */
    public boolean isSupervisory() {
        return this == SUPERVISOR || this == ADMIN;
    }
}
