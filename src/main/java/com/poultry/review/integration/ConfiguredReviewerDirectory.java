package com.poultry.review.integration;

import com.poultry.review.config.WorkflowConfig;
import com.poultry.review.exception.ValidationException;
import com.poultry.review.model.ReviewerProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reviewer directory seeded from {@code workflow.reviewers}. Registrations made
 * at runtime apply immediately and are lost on restart.
 */
@Component
public class ConfiguredReviewerDirectory implements ReviewerDirectory {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredReviewerDirectory.class);

    private final Map<String, ReviewerProfile> profiles = new ConcurrentHashMap<>();

    public ConfiguredReviewerDirectory(WorkflowConfig config) {
        for (ReviewerProfile profile : config.getReviewers()) {
            register(profile);
        }
        log.info("Reviewer directory loaded with {} reviewers", profiles.size());
    }

    @Override
    public ReviewerProfile resolve(String userId) {
        if (userId == null) return null;
        return profiles.get(userId);
    }

    @Override
    public List<ReviewerProfile> reviewers() {
        return List.copyOf(profiles.values());
    }

    public ReviewerProfile register(ReviewerProfile profile) {
        if (profile.getUserId() == null || profile.getUserId().isBlank()) {
            throw new ValidationException("userId is required");
        }
        if (profile.getRole() == null) {
            throw new ValidationException("role is required");
        }
        profiles.put(profile.getUserId(), profile);
        log.debug("Registered reviewer {} as {}", profile.getUserId(), profile.getRole());
        return profile;
    }
}
