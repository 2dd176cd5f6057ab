package com.poultry.review.integration;

import com.poultry.review.model.Application;

/**
 * Activates the applicant's account or program enrollment once the
 * application is finally approved.
 */
public interface AccountActivator {

    void activate(Application application, String identifier);
}
