package com.poultry.review.engine;

import com.poultry.review.model.Application;
import com.poultry.review.model.ReviewLevelDefinition;
import com.poultry.review.model.ReviewerProfile;
import org.springframework.stereotype.Component;

/**
 * Single place that decides whether a reviewer may act on an application at a level.
 * Used for claims, reassignment targets and every decision.
 */
@Component
public class ReviewAuthorizer {

    public boolean canReview(ReviewerProfile reviewer, ReviewLevelDefinition level, Application application) {
        if (reviewer == null || reviewer.getRole() == null || level == null) {
            return false;
        }
        if (reviewer.getRole().isSupervisory()) {
            return true;
        }
        if (!level.getRequiredRoles().contains(reviewer.getRole())) {
            return false;
        }
        if (level.getScope() == null) {
            return true;
        }
        return switch (level.getScope()) {
            case NATIONAL -> true;
            case REGION -> sameArea(reviewer.getRegion(), application.getRegion());
            case CONSTITUENCY -> sameArea(reviewer.getConstituency(), application.getConstituency());
        };
    }

    private boolean sameArea(String reviewerArea, String applicationArea) {
        return reviewerArea != null && reviewerArea.equalsIgnoreCase(applicationArea);
    }
}
