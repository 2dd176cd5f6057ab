package com.poultry.review.service;

import com.poultry.review.config.MetricsConfig;
import com.poultry.review.config.WorkflowConfig;
import com.poultry.review.exception.ApplicationNotFoundException;
import com.poultry.review.exception.ConcurrentUpdateException;
import com.poultry.review.model.ApplicationRecord;
import com.poultry.review.repository.ApplicationStore;
import com.poultry.review.repository.StaleRecordException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a change to one application as an all-or-nothing unit.
 *
 * <p>Each attempt reads the record, lets the mutation validate and change its
 * private copy, then writes it back conditionally on the version read. If
 * another writer got there first the whole attempt is repeated against the
 * fresh record, so validation always sees the state that is actually written
 * over. A mutation that throws leaves the stored record untouched.
 *
 * <p>Actions registered through the after-commit list run only once the write
 * has succeeded, and their failures never undo it.
 */
@Component
public class ApplicationTransactionTemplate {

    private static final Logger log = LoggerFactory.getLogger(ApplicationTransactionTemplate.class);

    @FunctionalInterface
    public interface Mutation<T> {
        T apply(ApplicationRecord record, List<Runnable> afterCommit);
    }

    private final ApplicationStore store;
    private final WorkflowConfig config;
    private final MetricsConfig metricsConfig;

    public ApplicationTransactionTemplate(ApplicationStore store, WorkflowConfig config,
                                          MetricsConfig metricsConfig) {
        this.store = store;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    public <T> T execute(String applicationId, Mutation<T> mutation) {
        int maxAttempts = Math.max(1, config.getMaxConflictRetries());

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            ApplicationRecord record = store.findById(applicationId);
            if (record == null) {
                throw new ApplicationNotFoundException(applicationId);
            }

            List<Runnable> afterCommit = new ArrayList<>();
            T result = mutation.apply(record, afterCommit);

            try {
                store.update(record);
            } catch (StaleRecordException e) {
                metricsConfig.recordConflictRetry();
                log.debug("Write conflict on application {} (attempt {}/{}): {}",
                        applicationId, attempt, maxAttempts, e.getMessage());
                continue;
            }

            runAfterCommit(applicationId, afterCommit);
            return result;
        }

        log.warn("Giving up on application {} after {} conflicting writes", applicationId, maxAttempts);
        throw new ConcurrentUpdateException(applicationId, maxAttempts);
    }

    public void create(ApplicationRecord record) {
        store.create(record);
    }

    private void runAfterCommit(String applicationId, List<Runnable> actions) {
        for (Runnable action : actions) {
            try {
                action.run();
            } catch (RuntimeException e) {
                log.error("Post-commit action failed for application {}; the committed change stands: {}",
                        applicationId, e.getMessage(), e);
            }
        }
    }
}
