package com.poultry.review.service;

import com.poultry.review.config.MetricsConfig;
import com.poultry.review.engine.PriorityRanker;
import com.poultry.review.engine.ReviewAuthorizer;
import com.poultry.review.exception.AlreadyClaimedException;
import com.poultry.review.exception.ApplicationNotFoundException;
import com.poultry.review.exception.DuplicateEntryException;
import com.poultry.review.exception.InvalidStateException;
import com.poultry.review.exception.NotClaimedByCallerException;
import com.poultry.review.exception.QueueEntryNotFoundException;
import com.poultry.review.exception.UnauthorizedActionException;
import com.poultry.review.integration.NotificationEvent;
import com.poultry.review.integration.ReviewerDirectory;
import com.poultry.review.model.Application;
import com.poultry.review.model.ApplicationRecord;
import com.poultry.review.model.QueueEntry;
import com.poultry.review.model.QueueEntryStatus;
import com.poultry.review.model.QueueFilter;
import com.poultry.review.model.ReviewActionType;
import com.poultry.review.model.ReviewLevelDefinition;
import com.poultry.review.model.ReviewerProfile;
import com.poultry.review.repository.ApplicationStore;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Per-level review queues and their claim lifecycle.
 *
 * <p>Queue entries live inside their application's record, so every queue
 * change is one conditional write of that record together with its audit row.
 * Claim therefore succeeds for exactly one of any number of racing callers:
 * the others re-read, find the entry no longer pending and get ALREADY_CLAIMED.
 *
 * <p>The record-level methods ({@link #enqueue}, {@link #complete},
 * {@link #markInProgress}, {@link #returnToReview}) change a record the
 * workflow engine is already writing and never write on their own.
 */
@Service
public class ReviewQueueService {

    private static final Logger log = LoggerFactory.getLogger(ReviewQueueService.class);

    private static final Pattern ENTRY_ID = Pattern.compile("^(.+)-L(\\d+)$");
    private static final long DAY_MS = 24L * 60 * 60 * 1000;

    private final ApplicationStore store;
    private final ApplicationTransactionTemplate transactionTemplate;
    private final AuditLog auditLog;
    private final PriorityRanker priorityRanker;
    private final ReviewAuthorizer authorizer;
    private final ReviewerDirectory reviewerDirectory;
    private final ProgramRulesProvider rulesProvider;
    private final NotificationDispatcher notificationDispatcher;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public ReviewQueueService(ApplicationStore store,
                              ApplicationTransactionTemplate transactionTemplate,
                              AuditLog auditLog,
                              PriorityRanker priorityRanker,
                              ReviewAuthorizer authorizer,
                              ReviewerDirectory reviewerDirectory,
                              ProgramRulesProvider rulesProvider,
                              NotificationDispatcher notificationDispatcher,
                              MetricsConfig metricsConfig,
                              Clock clock) {
        this.store = store;
        this.transactionTemplate = transactionTemplate;
        this.auditLog = auditLog;
        this.priorityRanker = priorityRanker;
        this.authorizer = authorizer;
        this.reviewerDirectory = reviewerDirectory;
        this.rulesProvider = rulesProvider;
        this.notificationDispatcher = notificationDispatcher;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    public static String entryId(String applicationId, int level) {
        return applicationId + "-L" + level;
    }

    // ── Record-level operations (run inside an engine transaction) ──

    public QueueEntry enqueue(ApplicationRecord record, int level, int slaDays, long now) {
        Application app = record.getApplication();
        if (record.findLiveEntry(level) != null) {
            throw new DuplicateEntryException(app.getApplicationId(), level);
        }

        QueueEntry entry = QueueEntry.builder()
                .entryId(entryId(app.getApplicationId(), level))
                .applicationId(app.getApplicationId())
                .kind(app.getKind())
                .reviewLevel(level)
                .status(QueueEntryStatus.PENDING)
                .enteredAt(now)
                .slaDeadline(now + slaDays * DAY_MS)
                .region(app.getRegion())
                .district(app.getDistrict())
                .constituency(app.getConstituency())
                .submittedAt(app.getSubmittedAt())
                .build();
        entry.setPriorityScore(priorityRanker.rank(app, entry, now));
        entry.setSuggestedAssignee(suggestAssignee(app, level));

        record.getQueueEntries().add(entry);
        log.debug("Enqueued {} at level {} (sla {} days, priority {}, suggested {})",
                app.getApplicationId(), level, slaDays, entry.getPriorityScore(), entry.getSuggestedAssignee());
        return entry;
    }

    /**
     * The non-supervisory reviewer allowed to decide the application at this
     * level who currently holds the fewest live entries; ties go to the lowest
     * user id. Null when nobody qualifies. The suggestion never assigns the
     * entry: it stays PENDING until someone claims it.
     */
    String suggestAssignee(Application app, int level) {
        List<ReviewerProfile> candidates = new ArrayList<>();
        ReviewLevelDefinition levelDef = null;
        for (ReviewerProfile reviewer : reviewerDirectory.reviewers()) {
            if (reviewer.getRole() == null || reviewer.getRole().isSupervisory()) continue;
            if (levelDef == null) {
                levelDef = rulesProvider.definition(app.getKind()).level(level);
            }
            if (authorizer.canReview(reviewer, levelDef, app)) {
                candidates.add(reviewer);
            }
        }
        if (candidates.isEmpty()) {
            return null;
        }

        Map<String, Integer> load = new HashMap<>();
        for (ApplicationRecord other : store.findAll()) {
            for (QueueEntry live : other.liveEntries()) {
                if (live.getAssignedTo() != null) {
                    load.merge(live.getAssignedTo(), 1, Integer::sum);
                }
            }
        }
        candidates.sort(Comparator.comparingInt((ReviewerProfile r) -> load.getOrDefault(r.getUserId(), 0))
                .thenComparing(ReviewerProfile::getUserId));
        return candidates.get(0).getUserId();
    }

    /**
     * Mark the live entry at a level completed. Completing a level that has
     * no live entry is a no-op.
     */
    public QueueEntry complete(ApplicationRecord record, int level, long now) {
        QueueEntry entry = record.findLiveEntry(level);
        if (entry == null) {
            return null;
        }
        entry.setStatus(QueueEntryStatus.COMPLETED);
        entry.setCompletedAt(now);
        return entry;
    }

    public void markInProgress(ApplicationRecord record, int level, String reviewerId, long now) {
        QueueEntry entry = requireLiveEntry(record, level);
        if (entry.getAssignedTo() == null || !entry.getAssignedTo().equals(reviewerId)) {
            entry.setAssignedTo(reviewerId);
            entry.setClaimedAt(now);
        }
        entry.setStatus(QueueEntryStatus.IN_PROGRESS);
    }

    /**
     * After a resubmission the entry goes back to its reviewer when it has
     * one, otherwise back to the open pool.
     */
    public void returnToReview(ApplicationRecord record, int level) {
        QueueEntry entry = requireLiveEntry(record, level);
        entry.setStatus(entry.getAssignedTo() != null ? QueueEntryStatus.CLAIMED : QueueEntryStatus.PENDING);
    }

    // ── Reviewer operations ──

    public List<QueueEntry> list(int level, QueueFilter filter) {
        QueueFilter effective = filter != null ? filter : QueueFilter.none();
        long now = clock.millis();
        List<QueueEntry> results = new ArrayList<>();

        for (ApplicationRecord record : store.findAll()) {
            QueueEntry entry = record.findLiveEntry(level);
            if (entry == null || !effective.matches(entry)) {
                continue;
            }
            entry.setPriorityScore(priorityRanker.rank(record.getApplication(), entry, now));
            results.add(entry);
        }

        results.sort(PriorityRanker.QUEUE_ORDER);
        return results;
    }

    @Observed(name = "queue.claim", contextualName = "claim-entry")
    public QueueEntry claim(String entryId, String reviewerId) {
        String applicationId = applicationIdOf(entryId);
        try {
            QueueEntry claimed = transactionTemplate.execute(applicationId, (record, afterCommit) -> {
                QueueEntry entry = requireEntry(record, entryId);
                if (entry.getStatus() != QueueEntryStatus.PENDING) {
                    throw new AlreadyClaimedException(entryId, entry.getAssignedTo());
                }
                requireAuthorized(record, entry.getReviewLevel(), reviewerId);

                long now = clock.millis();
                entry.setStatus(QueueEntryStatus.CLAIMED);
                entry.setAssignedTo(reviewerId);
                entry.setClaimedAt(now);
                auditLog.append(record, reviewerId, entry.getReviewLevel(), ReviewActionType.CLAIMED, null, now);
                return entry;
            });
            metricsConfig.recordClaim("success");
            log.info("Entry {} claimed by {}", entryId, reviewerId);
            return claimed;
        } catch (AlreadyClaimedException e) {
            metricsConfig.recordClaim("already_claimed");
            throw e;
        } catch (UnauthorizedActionException e) {
            metricsConfig.recordClaim("unauthorized");
            auditLog.recordPolicyViolation(applicationId, reviewerId, levelOf(entryId), e.getErrorCode(), e.getMessage());
            throw e;
        } catch (ApplicationNotFoundException e) {
            throw new QueueEntryNotFoundException(entryId);
        }
    }

    /**
     * Give a claimed entry back to the pool. Only the holder may release it,
     * and only before any decision work (a changes request) has started on it.
     */
    public QueueEntry release(String entryId, String reviewerId) {
        String applicationId = applicationIdOf(entryId);
        try {
            QueueEntry released = transactionTemplate.execute(applicationId, (record, afterCommit) -> {
                QueueEntry entry = requireEntry(record, entryId);
                if (!entry.getStatus().isLive()) {
                    throw new InvalidStateException("Queue entry " + entryId + " is already completed");
                }
                if (entry.getAssignedTo() == null || !entry.getAssignedTo().equals(reviewerId)) {
                    throw new NotClaimedByCallerException(entryId, reviewerId);
                }
                if (entry.getStatus() != QueueEntryStatus.CLAIMED) {
                    throw new InvalidStateException("Queue entry " + entryId + " has work in progress and cannot be released");
                }

                entry.setStatus(QueueEntryStatus.PENDING);
                entry.setAssignedTo(null);
                entry.setClaimedAt(0);
                auditLog.append(record, reviewerId, entry.getReviewLevel(), ReviewActionType.RELEASED, null, clock.millis());
                return entry;
            });
            log.info("Entry {} released by {}", entryId, reviewerId);
            return released;
        } catch (ApplicationNotFoundException e) {
            throw new QueueEntryNotFoundException(entryId);
        }
    }

    /**
     * Supervisory override: hand an entry to another reviewer regardless of
     * who holds it. The new reviewer must be allowed to review at the entry's level.
     */
    @Observed(name = "queue.reassign", contextualName = "reassign-entry")
    public QueueEntry reassign(String entryId, String supervisorId, String newReviewerId) {
        String applicationId = applicationIdOf(entryId);
        try {
            QueueEntry reassigned = transactionTemplate.execute(applicationId, (record, afterCommit) -> {
                QueueEntry entry = requireEntry(record, entryId);
                ReviewerProfile supervisor = reviewerDirectory.resolve(supervisorId);
                if (supervisor == null || supervisor.getRole() == null || !supervisor.getRole().isSupervisory()) {
                    throw new UnauthorizedActionException(supervisorId + " is not a supervisor and cannot reassign entries");
                }
                if (!entry.getStatus().isLive()) {
                    throw new InvalidStateException("Queue entry " + entryId + " is already completed");
                }
                requireAuthorized(record, entry.getReviewLevel(), newReviewerId);

                long now = clock.millis();
                String previous = entry.getAssignedTo();
                entry.setAssignedTo(newReviewerId);
                entry.setClaimedAt(now);
                if (entry.getStatus() == QueueEntryStatus.PENDING) {
                    entry.setStatus(QueueEntryStatus.CLAIMED);
                }
                auditLog.append(record, supervisorId, entry.getReviewLevel(), ReviewActionType.REASSIGNED,
                        String.format("from %s to %s", previous == null ? "unassigned" : previous, newReviewerId), now);
                return entry;
            });
            log.info("Entry {} reassigned to {} by {}", entryId, newReviewerId, supervisorId);
            return reassigned;
        } catch (UnauthorizedActionException e) {
            auditLog.recordPolicyViolation(applicationId, supervisorId, levelOf(entryId), e.getErrorCode(), e.getMessage());
            throw e;
        } catch (ApplicationNotFoundException e) {
            throw new QueueEntryNotFoundException(entryId);
        }
    }

    /**
     * Flag a live entry whose SLA deadline has passed. Each entry is escalated
     * at most once; returns false when there was nothing to do.
     */
    public boolean escalateOverdue(String entryId) {
        String applicationId = applicationIdOf(entryId);
        return transactionTemplate.execute(applicationId, (record, afterCommit) -> {
            QueueEntry entry = requireEntry(record, entryId);
            long now = clock.millis();
            if (!entry.getStatus().isLive() || entry.isEscalated()
                    || entry.getSlaDeadline() <= 0 || now <= entry.getSlaDeadline()) {
                return false;
            }

            entry.setEscalated(true);
            entry.setEscalatedAt(now);
            auditLog.append(record, null, entry.getReviewLevel(), ReviewActionType.ESCALATED,
                    "sla_deadline_passed", now);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("applicationId", applicationId);
            payload.put("entryId", entryId);
            payload.put("level", entry.getReviewLevel());
            payload.put("assignedTo", entry.getAssignedTo());
            payload.put("slaDeadline", entry.getSlaDeadline());
            afterCommit.add(() -> {
                metricsConfig.recordEscalation(entry.getReviewLevel());
                notificationDispatcher.dispatch("supervisors", NotificationEvent.QUEUE_ENTRY_ESCALATED, payload);
            });
            log.warn("Entry {} escalated: SLA deadline passed at {}", entryId, entry.getSlaDeadline());
            return true;
        });
    }

    public Map<String, Integer> stats(int level) {
        long now = clock.millis();
        int pending = 0, claimed = 0, inProgress = 0, completed = 0, overdue = 0, escalated = 0;

        for (ApplicationRecord record : store.findAll()) {
            for (QueueEntry entry : record.getQueueEntries()) {
                if (entry.getReviewLevel() != level) continue;
                switch (entry.getStatus()) {
                    case PENDING -> pending++;
                    case CLAIMED -> claimed++;
                    case IN_PROGRESS -> inProgress++;
                    case COMPLETED -> completed++;
                }
                if (entry.getStatus().isLive()) {
                    if (entry.getSlaDeadline() > 0 && now > entry.getSlaDeadline()) overdue++;
                    if (entry.isEscalated()) escalated++;
                }
            }
        }

        Map<String, Integer> stats = new LinkedHashMap<>();
        stats.put("pending", pending);
        stats.put("claimed", claimed);
        stats.put("inProgress", inProgress);
        stats.put("completed", completed);
        stats.put("overdue", overdue);
        stats.put("escalated", escalated);
        return stats;
    }

    // ── Helpers ──

    private void requireAuthorized(ApplicationRecord record, int level, String reviewerId) {
        Application app = record.getApplication();
        ReviewLevelDefinition levelDef = rulesProvider.definition(app.getKind()).level(level);
        ReviewerProfile reviewer = reviewerDirectory.resolve(reviewerId);
        if (!authorizer.canReview(reviewer, levelDef, app)) {
            throw new UnauthorizedActionException(String.format(
                    "%s may not review %s applications at level %d in %s/%s",
                    reviewerId, app.getKind(), level, app.getRegion(), app.getConstituency()));
        }
    }

    private QueueEntry requireEntry(ApplicationRecord record, String entryId) {
        QueueEntry entry = record.findEntry(entryId);
        if (entry == null) {
            throw new QueueEntryNotFoundException(entryId);
        }
        return entry;
    }

    private QueueEntry requireLiveEntry(ApplicationRecord record, int level) {
        QueueEntry entry = record.findLiveEntry(level);
        if (entry == null) {
            throw new InvalidStateException(String.format("Application %s has no live queue entry at level %d",
                    record.getApplication().getApplicationId(), level));
        }
        return entry;
    }

    private static String applicationIdOf(String entryId) {
        Matcher m = entryId == null ? null : ENTRY_ID.matcher(entryId);
        if (m == null || !m.matches()) {
            throw new QueueEntryNotFoundException(entryId);
        }
        return m.group(1);
    }

    private static Integer levelOf(String entryId) {
        Matcher m = ENTRY_ID.matcher(entryId);
        return m.matches() ? Integer.valueOf(m.group(2)) : null;
    }
}
