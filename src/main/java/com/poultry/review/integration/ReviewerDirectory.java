package com.poultry.review.integration;

import com.poultry.review.model.ReviewerProfile;

import java.util.List;

public interface ReviewerDirectory {

    /**
     * Role and jurisdiction of a user, or null when the user is not a known reviewer.
     */
    ReviewerProfile resolve(String userId);

    /**
     * Every known reviewer, in no particular order.
     */
    List<ReviewerProfile> reviewers();
}
