package com.poultry.review.repository;

/**
 * A conditional write lost: the stored record no longer has the version the
 * caller read (or, for a create, already exists).
 */
public class StaleRecordException extends RuntimeException {

    public StaleRecordException(String message) {
        super(message);
    }

    public StaleRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
