package com.poultry.review.service;

import com.poultry.review.config.MetricsConfig;
import com.poultry.review.exception.ApplicationNotFoundException;
import com.poultry.review.model.ApplicationRecord;
import com.poultry.review.model.ReviewAction;
import com.poultry.review.model.ReviewActionType;
import com.poultry.review.repository.ApplicationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Append-only ledger of who did what, when. Rows are added to the record
 * being changed so they commit together with the change they describe;
 * nothing ever edits or removes a row.
 */
@Service
public class AuditLog {

    private static final Logger log = LoggerFactory.getLogger(AuditLog.class);

    private final ApplicationStore store;
    private final ApplicationTransactionTemplate transactionTemplate;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public AuditLog(ApplicationStore store, ApplicationTransactionTemplate transactionTemplate,
                    MetricsConfig metricsConfig, Clock clock) {
        this.store = store;
        this.transactionTemplate = transactionTemplate;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    public ReviewAction append(ApplicationRecord record, String reviewerId, Integer level,
                               ReviewActionType action, String notes, long now) {
        String applicationId = record.getApplication().getApplicationId();
        ReviewAction row = ReviewAction.builder()
                .actionId(String.format("%s-A%03d", applicationId, record.getAuditTrail().size() + 1))
                .applicationId(applicationId)
                .reviewerId(reviewerId)
                .reviewLevel(level)
                .action(action)
                .notes(notes)
                .createdAt(now)
                .build();
        record.getAuditTrail().add(row);
        return row;
    }

    /**
     * Record a refused action (wrong level, unauthorized user, late
     * resubmission) as a security-relevant event. Written on its own; the
     * refused change itself was never applied.
     *
     * <p>Never throws: callers invoke this while handling the refusal and must
     * still surface the original error. A failed write is logged with the
     * violation so it can be reconstructed from the logs.
     *
     * @return true when the audit row was written
     */
    public boolean recordPolicyViolation(String applicationId, String userId, Integer level,
                                         String errorCode, String message) {
        log.warn("Policy violation on application {}: user={}, level={}, code={}, {}",
                applicationId, userId, level, errorCode, message);
        metricsConfig.recordPolicyViolation(errorCode);

        try {
            transactionTemplate.execute(applicationId, (record, afterCommit) ->
                    append(record, userId, level, ReviewActionType.POLICY_VIOLATION,
                            errorCode + ": " + message, clock.millis()));
            return true;
        } catch (RuntimeException e) {
            log.error("Could not write policy violation {} for application {} (user={}, level={})",
                    errorCode, applicationId, userId, level, e);
            return false;
        }
    }

    public List<ReviewAction> trail(String applicationId) {
        ApplicationRecord record = store.findById(applicationId);
        if (record == null) {
            throw new ApplicationNotFoundException(applicationId);
        }
        return List.copyOf(record.getAuditTrail());
    }
}
