package com.poultry.review.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTransition(String kind, String action) {
        Counter.builder("review.transition.count")
                .tag("kind", kind)
                .tag("action", action)
                .register(registry)
                .increment();
    }

    public void recordClaim(String outcome) {
        Counter.builder("review.claim.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordConflictRetry() {
        Counter.builder("review.conflict.retry.count")
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordEscalation(int level) {
        Counter.builder("review.escalation.count")
                .tag("level", String.valueOf(level))
                .register(registry)
                .increment();
    }

    public void recordAutoRejected(String reason) {
        Counter.builder("review.auto_rejected.count")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordPolicyViolation(String errorCode) {
        Counter.builder("review.policy_violation.count")
                .tag("error_code", errorCode)
                .register(registry)
                .increment();
    }
}
