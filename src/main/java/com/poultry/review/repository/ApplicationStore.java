package com.poultry.review.repository;

import com.poultry.review.model.ApplicationRecord;

import java.util.List;

/**
 * Storage for application records. Every write is conditional on the version
 * the record was read at, so concurrent writers cannot overwrite each other.
 * Records returned are private copies; changing them has no effect until
 * they are written back.
 */
public interface ApplicationStore {

    /**
     * @return the record, or null when no application has that id
     */
    ApplicationRecord findById(String applicationId);

    /**
     * Insert a new record. Sets the record's version on success.
     *
     * @throws StaleRecordException if a record with the same id already exists
     */
    void create(ApplicationRecord record);

    /**
     * Replace the stored record if its version still equals {@code record.getVersion()}.
     * Sets the record's version to the new stored version on success.
     *
     * @throws StaleRecordException if the record changed since it was read, or was never stored
     */
    void update(ApplicationRecord record);

    List<ApplicationRecord> findAll();
}
