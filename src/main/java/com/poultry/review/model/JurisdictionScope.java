package com.poultry.review.model;

/**
 * How far a review level's reviewers reach: a reviewer must share the
 * application's constituency, its region, or nothing at all.
 */
public enum JurisdictionScope {
    CONSTITUENCY,
    REGION,
    NATIONAL
}
