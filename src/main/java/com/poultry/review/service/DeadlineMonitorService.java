package com.poultry.review.service;

import com.poultry.review.exception.ReviewWorkflowException;
import com.poultry.review.model.Application;
import com.poultry.review.model.ApplicationRecord;
import com.poultry.review.model.ApplicationStatus;
import com.poultry.review.model.QueueEntry;
import com.poultry.review.repository.ApplicationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * Periodic sweep over open applications: expires change requests whose
 * deadline passed and escalates queue entries that are past their SLA.
 * Each item is handled in its own transaction, so one failure does not stop the sweep.
 */
@Service
public class DeadlineMonitorService {

    private static final Logger log = LoggerFactory.getLogger(DeadlineMonitorService.class);

    private final ApplicationStore store;
    private final ReviewWorkflowService workflowService;
    private final ReviewQueueService queueService;
    private final Clock clock;

    public DeadlineMonitorService(ApplicationStore store,
                                  ReviewWorkflowService workflowService,
                                  ReviewQueueService queueService,
                                  Clock clock) {
        this.store = store;
        this.workflowService = workflowService;
        this.queueService = queueService;
        this.clock = clock;
    }

    @Scheduled(fixedRateString = "${workflow.deadline-check-interval-seconds:300}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "60")
    public void checkDeadlines() {
        long now = clock.millis();
        int expired = 0;
        int escalated = 0;

        for (ApplicationRecord record : store.findAll()) {
            Application app = record.getApplication();
            if (app.getStatus() == ApplicationStatus.CHANGES_REQUESTED
                    && app.getChangesDeadline() > 0 && now > app.getChangesDeadline()) {
                try {
                    workflowService.expireChangesRequest(app.getApplicationId());
                    expired++;
                } catch (ReviewWorkflowException e) {
                    log.warn("Could not expire change request on {}: {}", app.getApplicationId(), e.getMessage());
                }
            }

            for (QueueEntry entry : record.liveEntries()) {
                if (entry.isEscalated() || entry.getSlaDeadline() <= 0 || now <= entry.getSlaDeadline()) {
                    continue;
                }
                try {
                    if (queueService.escalateOverdue(entry.getEntryId())) {
                        escalated++;
                    }
                } catch (ReviewWorkflowException e) {
                    log.warn("Could not escalate entry {}: {}", entry.getEntryId(), e.getMessage());
                }
            }
        }

        if (expired > 0 || escalated > 0) {
            log.info("Deadline check: {} expired change requests handled, {} overdue entries escalated",
                    expired, escalated);
        }
    }
}
