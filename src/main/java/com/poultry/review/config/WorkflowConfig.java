package com.poultry.review.config;

import com.poultry.review.model.ApplicationKind;
import com.poultry.review.model.ExpiryPolicy;
import com.poultry.review.model.ProgramDefinition;
import com.poultry.review.model.ReviewerProfile;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "workflow")
public class WorkflowConfig {

    // "memory" keeps records in-process; "aerospike" uses the cluster configured under aerospike.*
    private String storeType = "memory";

    // Days an applicant has to resubmit after changes are requested, when the reviewer gives none.
    private int changesDeadlineDays = 14;

    // What happens when a changes deadline passes without a resubmission.
    private ExpiryPolicy expiryPolicy = ExpiryPolicy.AUTO_REJECT;

    // Optimistic write attempts before an operation gives up with CONCURRENT_UPDATE.
    private int maxConflictRetries = 5;

    // How often the deadline monitor scans for expired change requests and overdue entries.
    private int deadlineCheckIntervalSeconds = 300;

    // Program definitions per kind; kinds left out fall back to built-in defaults.
    // The rules table of each definition comes from eligibility.* and is merged in at startup.
    private Map<ApplicationKind, ProgramDefinition> programs = new LinkedHashMap<>();

    // Reviewers known at startup; more can be registered at runtime.
    private List<ReviewerProfile> reviewers = new ArrayList<>();
}
