package com.poultry.review.integration;

import java.util.Map;

/**
 * Delivers workflow events to people. Called after a transition has been
 * committed; implementations may throw, the caller logs and moves on.
 */
public interface Notifier {

    /**
     * @param recipient applicant id, reviewer id, or a group name such as "supervisors"
     * @param event     what happened
     * @param payload   event details (application id, status, level, contact fields)
     */
    void notify(String recipient, NotificationEvent event, Map<String, Object> payload);

    default String channel() {
        return "log";
    }
}
