package com.poultry.review.service;

import com.poultry.review.config.MetricsConfig;
import com.poultry.review.config.WorkflowConfig;
import com.poultry.review.engine.EligibilityScorer;
import com.poultry.review.engine.ReviewAuthorizer;
import com.poultry.review.engine.ScreeningContext;
import com.poultry.review.exception.ApplicationNotFoundException;
import com.poultry.review.exception.DeadlineExpiredException;
import com.poultry.review.exception.InvalidStateException;
import com.poultry.review.exception.LevelMismatchException;
import com.poultry.review.exception.NotClaimedByCallerException;
import com.poultry.review.exception.UnauthorizedActionException;
import com.poultry.review.exception.ValidationException;
import com.poultry.review.integration.AccountActivator;
import com.poultry.review.integration.IdentifierIssuer;
import com.poultry.review.integration.NotificationEvent;
import com.poultry.review.integration.ReviewerDirectory;
import com.poultry.review.model.ApplicantSnapshot;
import com.poultry.review.model.Application;
import com.poultry.review.model.ApplicationDraft;
import com.poultry.review.model.ApplicationRecord;
import com.poultry.review.model.ApplicationStatus;
import com.poultry.review.model.EligibilityResult;
import com.poultry.review.model.ExpiryPolicy;
import com.poultry.review.model.ProgramDefinition;
import com.poultry.review.model.QueueEntry;
import com.poultry.review.model.QueueFilter;
import com.poultry.review.model.ReviewAction;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * The review state machine, shared by every application kind.
 *
 * <pre>
 *   DRAFT --submit--> UNDER_REVIEW(level 1) --approve--> UNDER_REVIEW(level k+1) ... --approve(last)--> APPROVED
 *                  \-> REJECTED (eligibility)       |--reject--> REJECTED
 *                                                   |--requestChanges--> CHANGES_REQUESTED --resubmit--> UNDER_REVIEW (same level)
 *                                                                                         |--deadline--> REJECTED (AUTO_REJECT) or escalated (ESCALATE)
 *                                                                                         \--extendChangesDeadline--> CHANGES_REQUESTED
 *   any non-terminal --withdraw--> WITHDRAWN
 * </pre>
 *
 * Every transition commits the application, its queue entries and its audit
 * row in one conditional write. Notifications and account activation run
 * after the commit and cannot undo it.
 */
@Service
public class ReviewWorkflowService {

    private static final Logger log = LoggerFactory.getLogger(ReviewWorkflowService.class);

    static final String CHANGES_DEADLINE_EXPIRED = "changes_deadline_expired";
    static final String ELIGIBILITY_FAILED = "eligibility_failed";
    private static final long DAY_MS = 24L * 60 * 60 * 1000;

    private final ApplicationStore store;
    private final ApplicationTransactionTemplate transactionTemplate;
    private final ReviewQueueService queueService;
    private final AuditLog auditLog;
    private final EligibilityScorer eligibilityScorer;
    private final ProgramRulesProvider rulesProvider;
    private final ReviewAuthorizer authorizer;
    private final ReviewerDirectory reviewerDirectory;
    private final IdentifierIssuer identifierIssuer;
    private final AccountActivator accountActivator;
    private final NotificationDispatcher notificationDispatcher;
    private final WorkflowConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public ReviewWorkflowService(ApplicationStore store,
                                 ApplicationTransactionTemplate transactionTemplate,
                                 ReviewQueueService queueService,
                                 AuditLog auditLog,
                                 EligibilityScorer eligibilityScorer,
                                 ProgramRulesProvider rulesProvider,
                                 ReviewAuthorizer authorizer,
                                 ReviewerDirectory reviewerDirectory,
                                 IdentifierIssuer identifierIssuer,
                                 AccountActivator accountActivator,
                                 NotificationDispatcher notificationDispatcher,
                                 WorkflowConfig config,
                                 MetricsConfig metricsConfig,
                                 Clock clock) {
        this.store = store;
        this.transactionTemplate = transactionTemplate;
        this.queueService = queueService;
        this.auditLog = auditLog;
        this.eligibilityScorer = eligibilityScorer;
        this.rulesProvider = rulesProvider;
        this.authorizer = authorizer;
        this.reviewerDirectory = reviewerDirectory;
        this.identifierIssuer = identifierIssuer;
        this.accountActivator = accountActivator;
        this.notificationDispatcher = notificationDispatcher;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    // ── Applicant operations ──

    public Application createDraft(ApplicationDraft draft) {
        if (draft == null || isBlank(draft.getApplicantId())) {
            throw new ValidationException("applicantId is required");
        }
        if (draft.getKind() == null) {
            throw new ValidationException("kind is required");
        }

        Application application = Application.builder()
                .applicationId("APP-" + UUID.randomUUID())
                .applicantId(draft.getApplicantId())
                .kind(draft.getKind())
                .status(ApplicationStatus.DRAFT)
                .region(draft.getRegion())
                .district(draft.getDistrict())
                .constituency(draft.getConstituency())
                .snapshot(draft.getSnapshot() != null ? draft.getSnapshot() : new ApplicantSnapshot())
                .createdAt(clock.millis())
                .build();

        transactionTemplate.create(ApplicationRecord.builder().application(application).build());
        log.info("Draft {} created: kind={}, applicant={}",
                application.getApplicationId(), application.getKind(), application.getApplicantId());
        return application;
    }

    /**
     * Screen a draft and, if it passes, put it in the level-1 queue.
     * A failing application is rejected without ever entering a queue.
     */
    @Observed(name = "workflow.submit", contextualName = "submit-application")
    public Application submit(String applicationId) {
        return transactionTemplate.execute(applicationId, (record, afterCommit) -> {
            Application app = record.getApplication();
            if (app.getStatus() != ApplicationStatus.DRAFT) {
                throw new InvalidStateException("Application " + applicationId + " is " + app.getStatus()
                        + "; only drafts can be submitted");
            }
            validateForSubmission(app);

            long now = clock.millis();
            ProgramDefinition program = rulesProvider.definition(app.getKind());
            EligibilityResult eligibility = eligibilityScorer.score(ScreeningContext.builder()
                    .snapshot(app.getSnapshot())
                    .constituency(app.getConstituency())
                    .submittedAt(now)
                    .build(), program.getRules());

            app.setSubmittedAt(now);
            app.setEligibilityScore(eligibility.getScore());
            app.setEligibilityFlags(new ArrayList<>(eligibility.getFlags()));

            if (!eligibility.isPassed()) {
                app.setStatus(ApplicationStatus.REJECTED);
                app.setCurrentReviewLevel(null);
                app.setFinalDecisionAt(now);
                app.setRejectionReason(ELIGIBILITY_FAILED);
                auditLog.append(record, null, null, ReviewActionType.ELIGIBILITY_FAILED,
                        String.format("score=%d flags=%s", eligibility.getScore(), eligibility.getFlags()), now);
                afterCommit.add(() -> {
                    metricsConfig.recordAutoRejected(ELIGIBILITY_FAILED);
                    log.warn("Application {} failed eligibility: score={}, flags={}",
                            applicationId, eligibility.getScore(), eligibility.getFlags());
                });
                notifyApplicant(afterCommit, app, NotificationEvent.ELIGIBILITY_FAILED, null);
                return app;
            }

            app.setStatus(ApplicationStatus.UNDER_REVIEW);
            app.setCurrentReviewLevel(1);
            auditLog.append(record, app.getApplicantId(), 1, ReviewActionType.SUBMITTED,
                    "eligibility score " + eligibility.getScore(), now);
            queueService.enqueue(record, 1, program.level(1).getSlaDays(), now);

            afterCommit.add(() -> {
                metricsConfig.recordTransition(app.getKind().name(), ReviewActionType.SUBMITTED.name());
                log.info("Application {} submitted: score={}, entering level 1", applicationId, eligibility.getScore());
            });
            notifyApplicant(afterCommit, app, NotificationEvent.APPLICATION_SUBMITTED, null);
            return app;
        });
    }

    /**
     * Apply the applicant's changes and send the application back to review at
     * the same level. Eligibility is not re-scored.
     *
     * <p>A resubmission after the deadline depends on workflow.expiry-policy.
     * Under AUTO_REJECT it is refused, audited as a policy violation, and the
     * application is rejected; the rejected application is returned. Under
     * ESCALATE the overdue application stays open for the applicant, so the
     * late resubmission is accepted and noted in the audit row.
     */
    @Observed(name = "workflow.resubmit", contextualName = "resubmit-application")
    public Application resubmit(String applicationId, String applicantId, ApplicantSnapshot snapshot) {
        try {
            return guarded(applicationId, applicantId, null, () ->
                    transactionTemplate.execute(applicationId, (record, afterCommit) -> {
                        Application app = record.getApplication();
                        requireApplicant(app, applicantId);
                        if (app.getStatus() != ApplicationStatus.CHANGES_REQUESTED) {
                            throw new InvalidStateException("Application " + applicationId + " is " + app.getStatus()
                                    + "; only applications with requested changes can be resubmitted");
                        }

                        long now = clock.millis();
                        boolean late = app.getChangesDeadline() > 0 && now > app.getChangesDeadline();
                        if (late && config.getExpiryPolicy() == ExpiryPolicy.AUTO_REJECT) {
                            throw new DeadlineExpiredException(applicationId, app.getChangesDeadline());
                        }
                        if (snapshot == null) {
                            throw new ValidationException("snapshot is required");
                        }
                        validateSnapshot(snapshot);

                        int level = app.getCurrentReviewLevel();
                        app.setSnapshot(snapshot);
                        app.setStatus(ApplicationStatus.UNDER_REVIEW);
                        queueService.returnToReview(record, level);
                        auditLog.append(record, applicantId, level, ReviewActionType.RESUBMITTED,
                                late ? "after deadline " + app.getChangesDeadline() : null, now);
                        app.setChangesDeadline(0);

                        afterCommit.add(() -> {
                            metricsConfig.recordTransition(app.getKind().name(), ReviewActionType.RESUBMITTED.name());
                            log.info("Application {} resubmitted at level {}{}", applicationId, level,
                                    late ? " after its deadline" : "");
                        });
                        notifyApplicant(afterCommit, app, NotificationEvent.APPLICATION_RESUBMITTED, null);
                        return app;
                    }));
        } catch (DeadlineExpiredException e) {
            log.warn("Late resubmission of {}: {}", applicationId, e.getMessage());
            auditLog.recordPolicyViolation(applicationId, applicantId, null, e.getErrorCode(), e.getMessage());
            return autoReject(applicationId);
        }
    }

    public Application withdraw(String applicationId, String applicantId) {
        return guarded(applicationId, applicantId, null, () ->
                transactionTemplate.execute(applicationId, (record, afterCommit) -> {
                    Application app = record.getApplication();
                    requireApplicant(app, applicantId);
                    if (app.getStatus().isTerminal()) {
                        throw new InvalidStateException("Application " + applicationId + " is already " + app.getStatus());
                    }

                    long now = clock.millis();
                    Integer level = app.getCurrentReviewLevel();
                    for (QueueEntry entry : record.liveEntries()) {
                        queueService.complete(record, entry.getReviewLevel(), now);
                    }
                    app.setStatus(ApplicationStatus.WITHDRAWN);
                    app.setCurrentReviewLevel(null);
                    app.setFinalDecisionAt(now);
                    app.setChangesDeadline(0);
                    auditLog.append(record, applicantId, level, ReviewActionType.WITHDRAWN, null, now);

                    afterCommit.add(() -> {
                        metricsConfig.recordTransition(app.getKind().name(), ReviewActionType.WITHDRAWN.name());
                        log.info("Application {} withdrawn by applicant", applicationId);
                    });
                    notifyApplicant(afterCommit, app, NotificationEvent.APPLICATION_WITHDRAWN, null);
                    return app;
                }));
    }

    // ── Reviewer decisions ──

    /**
     * Approve at the current level. At the last level this issues the
     * identifier, activates the account when the program asks for it, and
     * closes the application; otherwise the application moves to the next level.
     */
    @Observed(name = "workflow.approve", contextualName = "approve-application")
    public Application approve(String applicationId, String reviewerId, int level, String notes) {
        return guarded(applicationId, reviewerId, level, () ->
                transactionTemplate.execute(applicationId, (record, afterCommit) -> {
                    Application app = record.getApplication();
                    ProgramDefinition program = rulesProvider.definition(app.getKind());
                    guardDecision(record, program, reviewerId, level, false);

                    long now = clock.millis();
                    queueService.complete(record, level, now);
                    auditLog.append(record, reviewerId, level, ReviewActionType.APPROVED, notes, now);

                    if (level >= program.levelCount()) {
                        String identifier = identifierIssuer.issueIdentifier(app);
                        app.setIssuedIdentifier(identifier);
                        app.setStatus(ApplicationStatus.APPROVED);
                        app.setCurrentReviewLevel(null);
                        app.setFinalDecisionAt(now);

                        if (program.isActivateAccount()) {
                            Application approved = app.toBuilder().build();
                            afterCommit.add(() -> accountActivator.activate(approved, identifier));
                        }
                        afterCommit.add(() -> {
                            metricsConfig.recordTransition(app.getKind().name(), ReviewActionType.APPROVED.name());
                            log.info("Application {} approved at final level {} by {}; identifier {}",
                                    applicationId, level, reviewerId, identifier);
                        });
                        notifyApplicant(afterCommit, app, NotificationEvent.APPLICATION_APPROVED, notes);
                        return app;
                    }

                    int next = level + 1;
                    app.setCurrentReviewLevel(next);
                    queueService.enqueue(record, next, program.level(next).getSlaDays(), now);
                    afterCommit.add(() -> {
                        metricsConfig.recordTransition(app.getKind().name(), "ADVANCED");
                        log.info("Application {} approved at level {} by {}; advancing to level {}",
                                applicationId, level, reviewerId, next);
                    });
                    notifyApplicant(afterCommit, app, NotificationEvent.APPLICATION_ADVANCED, notes);
                    return app;
                }));
    }

    @Observed(name = "workflow.reject", contextualName = "reject-application")
    public Application reject(String applicationId, String reviewerId, int level, String reason) {
        if (isBlank(reason)) {
            throw new ValidationException("A rejection reason is required");
        }
        return guarded(applicationId, reviewerId, level, () ->
                transactionTemplate.execute(applicationId, (record, afterCommit) -> {
                    Application app = record.getApplication();
                    ProgramDefinition program = rulesProvider.definition(app.getKind());
                    guardDecision(record, program, reviewerId, level, true);

                    long now = clock.millis();
                    queueService.complete(record, level, now);
                    auditLog.append(record, reviewerId, level, ReviewActionType.REJECTED, reason, now);
                    app.setStatus(ApplicationStatus.REJECTED);
                    app.setCurrentReviewLevel(null);
                    app.setFinalDecisionAt(now);
                    app.setRejectionReason(reason);
                    app.setChangesDeadline(0);

                    afterCommit.add(() -> {
                        metricsConfig.recordTransition(app.getKind().name(), ReviewActionType.REJECTED.name());
                        log.info("Application {} rejected at level {} by {}: {}", applicationId, level, reviewerId, reason);
                    });
                    notifyApplicant(afterCommit, app, NotificationEvent.APPLICATION_REJECTED, reason);
                    return app;
                }));
    }

    /**
     * Pause review until the applicant resubmits. The application keeps its
     * level and the entry stays with the requesting reviewer.
     *
     * @param deadlineDays days the applicant has to resubmit; null uses workflow.changes-deadline-days
     */
    @Observed(name = "workflow.request_changes", contextualName = "request-changes")
    public Application requestChanges(String applicationId, String reviewerId, int level,
                                      String requestedChanges, Integer deadlineDays) {
        if (isBlank(requestedChanges)) {
            throw new ValidationException("The requested changes must be described");
        }
        int days = deadlineDays != null ? deadlineDays : config.getChangesDeadlineDays();
        if (days <= 0) {
            throw new ValidationException("deadlineDays must be > 0");
        }

        return guarded(applicationId, reviewerId, level, () ->
                transactionTemplate.execute(applicationId, (record, afterCommit) -> {
                    Application app = record.getApplication();
                    ProgramDefinition program = rulesProvider.definition(app.getKind());
                    guardDecision(record, program, reviewerId, level, false);

                    long now = clock.millis();
                    queueService.markInProgress(record, level, reviewerId, now);
                    app.setStatus(ApplicationStatus.CHANGES_REQUESTED);
                    app.setChangesRequested(requestedChanges);
                    app.setChangesDeadline(now + days * DAY_MS);
                    auditLog.append(record, reviewerId, level, ReviewActionType.CHANGES_REQUESTED,
                            requestedChanges + " (due in " + days + " days)", now);

                    afterCommit.add(() -> {
                        metricsConfig.recordTransition(app.getKind().name(), ReviewActionType.CHANGES_REQUESTED.name());
                        log.info("Changes requested on {} at level {} by {}, due {}",
                                applicationId, level, reviewerId, app.getChangesDeadline());
                    });
                    notifyApplicant(afterCommit, app, NotificationEvent.CHANGES_REQUESTED, requestedChanges);
                    return app;
                }));
    }

    // ── Deadline handling ──

    /**
     * Act on a change request whose deadline passed without a resubmission,
     * following workflow.expiry-policy. Does nothing when the application is
     * no longer waiting on changes or the deadline has not passed.
     */
    public Application expireChangesRequest(String applicationId) {
        if (config.getExpiryPolicy() == ExpiryPolicy.ESCALATE) {
            return escalateExpiredChanges(applicationId);
        }
        return autoReject(applicationId);
    }

    private Application autoReject(String applicationId) {
        return transactionTemplate.execute(applicationId, (record, afterCommit) -> {
            Application app = record.getApplication();
            long now = clock.millis();
            if (!isExpired(app, now)) {
                return app;
            }

            Integer level = app.getCurrentReviewLevel();
            if (level != null) {
                queueService.complete(record, level, now);
            }
            auditLog.append(record, null, level, ReviewActionType.AUTO_REJECTED, CHANGES_DEADLINE_EXPIRED, now);
            app.setStatus(ApplicationStatus.REJECTED);
            app.setCurrentReviewLevel(null);
            app.setFinalDecisionAt(now);
            app.setRejectionReason(CHANGES_DEADLINE_EXPIRED);

            afterCommit.add(() -> {
                metricsConfig.recordAutoRejected(CHANGES_DEADLINE_EXPIRED);
                log.warn("Application {} auto-rejected: changes deadline {} passed", applicationId, app.getChangesDeadline());
            });
            notifyApplicant(afterCommit, app, NotificationEvent.CHANGES_DEADLINE_EXPIRED, CHANGES_DEADLINE_EXPIRED);
            return app;
        });
    }

    private Application escalateExpiredChanges(String applicationId) {
        return transactionTemplate.execute(applicationId, (record, afterCommit) -> {
            Application app = record.getApplication();
            long now = clock.millis();
            if (!isExpired(app, now)) {
                return app;
            }
            int level = app.getCurrentReviewLevel();
            QueueEntry entry = record.findLiveEntry(level);
            if (entry == null || entry.isEscalated()) {
                return app;
            }

            entry.setEscalated(true);
            entry.setEscalatedAt(now);
            auditLog.append(record, null, level, ReviewActionType.ESCALATED, CHANGES_DEADLINE_EXPIRED, now);

            Map<String, Object> payload = payload(app, CHANGES_DEADLINE_EXPIRED);
            payload.put("entryId", entry.getEntryId());
            payload.put("assignedTo", entry.getAssignedTo());
            afterCommit.add(() -> {
                metricsConfig.recordEscalation(level);
                log.warn("Application {} escalated: changes deadline {} passed", applicationId, app.getChangesDeadline());
                notificationDispatcher.dispatch("supervisors", NotificationEvent.CHANGES_DEADLINE_EXPIRED, payload);
            });
            return app;
        });
    }

    /**
     * Supervisory override: give the applicant more time on an open change
     * request, overdue or not. The new deadline counts from now, and an
     * escalation raised for the missed deadline is cleared.
     */
    @Observed(name = "workflow.extend_deadline", contextualName = "extend-changes-deadline")
    public Application extendChangesDeadline(String applicationId, String supervisorId, int extraDays) {
        if (extraDays <= 0) {
            throw new ValidationException("extraDays must be > 0");
        }
        return guarded(applicationId, supervisorId, null, () ->
                transactionTemplate.execute(applicationId, (record, afterCommit) -> {
                    Application app = record.getApplication();
                    ReviewerProfile supervisor = reviewerDirectory.resolve(supervisorId);
                    if (supervisor == null || supervisor.getRole() == null || !supervisor.getRole().isSupervisory()) {
                        throw new UnauthorizedActionException(
                                supervisorId + " is not a supervisor and cannot extend change deadlines");
                    }
                    if (app.getStatus() != ApplicationStatus.CHANGES_REQUESTED) {
                        throw new InvalidStateException("Application " + applicationId + " is " + app.getStatus()
                                + "; only open change requests can be extended");
                    }

                    long now = clock.millis();
                    long previous = app.getChangesDeadline();
                    Integer level = app.getCurrentReviewLevel();
                    app.setChangesDeadline(now + extraDays * DAY_MS);
                    QueueEntry entry = level == null ? null : record.findLiveEntry(level);
                    if (entry != null && entry.isEscalated() && previous > 0 && now > previous) {
                        entry.setEscalated(false);
                        entry.setEscalatedAt(0);
                    }
                    auditLog.append(record, supervisorId, level, ReviewActionType.DEADLINE_EXTENDED,
                            String.format("from %d to %d", previous, app.getChangesDeadline()), now);

                    afterCommit.add(() -> {
                        metricsConfig.recordTransition(app.getKind().name(), ReviewActionType.DEADLINE_EXTENDED.name());
                        log.info("Changes deadline of {} extended by {} days by {}", applicationId, extraDays, supervisorId);
                    });
                    notifyApplicant(afterCommit, app, NotificationEvent.CHANGES_DEADLINE_EXTENDED,
                            "new deadline " + app.getChangesDeadline());
                    return app;
                }));
    }

    // ── Reads ──

    public Application getApplication(String applicationId) {
        ApplicationRecord record = store.findById(applicationId);
        if (record == null) {
            throw new ApplicationNotFoundException(applicationId);
        }
        return record.getApplication();
    }

    public List<ReviewAction> getAuditTrail(String applicationId) {
        return auditLog.trail(applicationId);
    }

    public List<QueueEntry> listQueue(int level, QueueFilter filter) {
        return queueService.list(level, filter);
    }

    // ── Guards ──

    /**
     * Checks shared by approve, reject and requestChanges, in order: the
     * application is under review at exactly this level, the reviewer may
     * review at this level, and the entry is not held by someone else
     * (supervisors may decide entries claimed by others).
     */
    private void guardDecision(ApplicationRecord record, ProgramDefinition program, String reviewerId,
                               int level, boolean allowWhileChangesRequested) {
        Application app = record.getApplication();
        if (!app.getStatus().isInReview() || app.getCurrentReviewLevel() == null
                || app.getCurrentReviewLevel() != level) {
            throw new LevelMismatchException(app.getApplicationId(), level, app.getCurrentReviewLevel());
        }

        ReviewerProfile reviewer = reviewerDirectory.resolve(reviewerId);
        ReviewLevelDefinition levelDef = program.level(level);
        if (!authorizer.canReview(reviewer, levelDef, app)) {
            throw new UnauthorizedActionException(String.format(
                    "%s may not decide %s applications at level %d in %s/%s",
                    reviewerId, app.getKind(), level, app.getRegion(), app.getConstituency()));
        }

        if (app.getStatus() == ApplicationStatus.CHANGES_REQUESTED && !allowWhileChangesRequested) {
            throw new InvalidStateException("Application " + app.getApplicationId()
                    + " is waiting for the applicant's changes");
        }

        QueueEntry entry = record.findLiveEntry(level);
        if (entry == null) {
            throw new InvalidStateException("Application " + app.getApplicationId()
                    + " has no live queue entry at level " + level);
        }
        if (entry.getAssignedTo() != null && !entry.getAssignedTo().equals(reviewerId)
                && !reviewer.getRole().isSupervisory()) {
            throw new NotClaimedByCallerException(String.format(
                    "Queue entry %s is claimed by %s, not %s", entry.getEntryId(), entry.getAssignedTo(), reviewerId));
        }
    }

    /**
     * Runs an operation and records level mismatches and unauthorized attempts
     * as policy violations before passing them on. Refused attempts are never
     * retried, and a failure to audit them never replaces the refusal.
     */
    private Application guarded(String applicationId, String userId, Integer level, Supplier<Application> operation) {
        try {
            return operation.get();
        } catch (LevelMismatchException | UnauthorizedActionException e) {
            auditLog.recordPolicyViolation(applicationId, userId, level, e.getErrorCode(), e.getMessage());
            throw e;
        }
    }

    private void requireApplicant(Application app, String applicantId) {
        if (applicantId == null || !applicantId.equals(app.getApplicantId())) {
            throw new UnauthorizedActionException(String.format(
                    "%s is not the applicant of %s", applicantId, app.getApplicationId()));
        }
    }

    private boolean isExpired(Application app, long now) {
        return app.getStatus() == ApplicationStatus.CHANGES_REQUESTED
                && app.getChangesDeadline() > 0
                && now > app.getChangesDeadline();
    }

    // ── Validation ──

    private void validateForSubmission(Application app) {
        List<String> missing = new ArrayList<>();
        if (isBlank(app.getApplicantId())) missing.add("applicantId");
        if (app.getKind() == null) missing.add("kind");
        if (isBlank(app.getRegion())) missing.add("region");
        if (isBlank(app.getDistrict())) missing.add("district");
        if (isBlank(app.getConstituency())) missing.add("constituency");
        if (!missing.isEmpty()) {
            throw new ValidationException("Missing required fields: " + String.join(", ", missing));
        }
        validateSnapshot(app.getSnapshot());
    }

    private void validateSnapshot(ApplicantSnapshot snapshot) {
        if (snapshot == null || isBlank(snapshot.getApplicantName())) {
            throw new ValidationException("Missing required fields: applicantName");
        }
        if (isBlank(snapshot.getEmail()) && isBlank(snapshot.getPhone())) {
            throw new ValidationException("At least one contact (email or phone) is required");
        }
        if (snapshot.getApplicantAge() != null && snapshot.getApplicantAge() < 0) {
            throw new ValidationException("applicantAge must be >= 0");
        }
        if (snapshot.getBirdCapacity() != null && snapshot.getBirdCapacity() < 0) {
            throw new ValidationException("birdCapacity must be >= 0");
        }
    }

    // ── Notifications ──

    private void notifyApplicant(List<Runnable> afterCommit, Application app, NotificationEvent event, String notes) {
        Map<String, Object> payload = payload(app, notes);
        String recipient = app.getApplicantId();
        afterCommit.add(() -> notificationDispatcher.dispatch(recipient, event, payload));
    }

    private Map<String, Object> payload(Application app, String notes) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("applicationId", app.getApplicationId());
        payload.put("kind", app.getKind().name());
        payload.put("status", app.getStatus().name());
        payload.put("level", app.getCurrentReviewLevel());
        payload.put("identifier", app.getIssuedIdentifier());
        payload.put("notes", notes);
        if (app.getSnapshot() != null) {
            payload.put("phone", app.getSnapshot().getPhone());
            payload.put("email", app.getSnapshot().getEmail());
        }
        return payload;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
