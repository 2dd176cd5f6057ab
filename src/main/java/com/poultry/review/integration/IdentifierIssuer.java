package com.poultry.review.integration;

import com.poultry.review.model.Application;

/**
 * Mints the human-readable identifier handed out on final approval.
 * Calling it again for the same application must return the same identifier.
 */
public interface IdentifierIssuer {

    String issueIdentifier(Application application);
}
