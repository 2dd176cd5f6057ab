package com.poultry.review.repository;

/**
 * Durable state behind identifier issuing: one counter per identifier series
 * and the identifier each application was given. Both must outlive the
 * process whenever applications do.
 */
public interface IdentifierSequenceStore {

    /**
     * Atomically increment the counter of a series and return the new value.
     * The first call for a series returns 1.
     */
    long nextValue(String series);

    /**
     * @return the identifier already issued to the application, or null
     */
    String findIssued(String applicationId);

    /**
     * Bind an identifier to an application unless it already has one.
     *
     * @return the identifier bound to the application after the call, which is
     *         the existing one when another caller got there first
     */
    String bindIfAbsent(String applicationId, String identifier);
}
