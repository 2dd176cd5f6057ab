package com.poultry.review.model;

/**
 * The three application flows that share the review workflow.
 * They differ only in their program definition and terminal action.
 */
public enum ApplicationKind {
    FARMER_REGISTRATION,
    PROGRAM_ENROLLMENT,
    STAFF_INVITATION
}
