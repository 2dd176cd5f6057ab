package com.poultry.review.service;

import com.poultry.review.config.MetricsConfig;
import com.poultry.review.integration.NotificationEvent;
import com.poultry.review.integration.Notifier;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Hands committed workflow events to the notifier off the request thread.
 * Delivery failures are counted and logged; they never reach the caller.
 */
@Service
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final Notifier notifier;
    private final MetricsConfig metricsConfig;

    public NotificationDispatcher(Notifier notifier, MetricsConfig metricsConfig) {
        this.notifier = notifier;
        this.metricsConfig = metricsConfig;
    }

    @Async
    @Observed(name = "notification.send", contextualName = "send-notification")
    public void dispatch(String recipient, NotificationEvent event, Map<String, Object> payload) {
        try {
            notifier.notify(recipient, event, payload);
            metricsConfig.recordNotification(notifier.channel(), "success");
        } catch (Exception e) {
            metricsConfig.recordNotification(notifier.channel(), "error");
            log.error("Failed to send {} notification to {} for application {}: {}",
                    event, recipient, payload.get("applicationId"), e.getMessage(), e);
        }
    }
}
