package com.poultry.review.integration;

import com.poultry.review.model.Application;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingAccountActivator implements AccountActivator {

    private static final Logger log = LoggerFactory.getLogger(LoggingAccountActivator.class);

    @Override
    public void activate(Application application, String identifier) {
        log.info("Activating {} for applicant={} application={} identifier={}",
                application.getKind(), application.getApplicantId(), application.getApplicationId(), identifier);
    }
}
