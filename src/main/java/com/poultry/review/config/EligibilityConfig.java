package com.poultry.review.config;

import com.poultry.review.model.ApplicationKind;
import com.poultry.review.model.ProgramRules;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "eligibility")
public class EligibilityConfig {

    // Rule table per application kind. Kinds left out are screened with ProgramRules defaults.
    private Map<ApplicationKind, ProgramRules> rules = new LinkedHashMap<>();
}
