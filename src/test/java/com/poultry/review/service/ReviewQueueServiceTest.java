package com.poultry.review.service;

import com.poultry.review.exception.AlreadyClaimedException;
import com.poultry.review.exception.DuplicateEntryException;
import com.poultry.review.exception.InvalidStateException;
import com.poultry.review.exception.NotClaimedByCallerException;
import com.poultry.review.exception.QueueEntryNotFoundException;
import com.poultry.review.exception.UnauthorizedActionException;
import com.poultry.review.integration.AccountActivator;
import com.poultry.review.integration.IdentifierIssuer;
import com.poultry.review.integration.NotificationEvent;
import com.poultry.review.model.*;
import com.poultry.review.testutil.WorkflowFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.poultry.review.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(MockitoExtension.class)
class ReviewQueueServiceTest {

    @Mock private IdentifierIssuer identifierIssuer;
    @Mock private AccountActivator accountActivator;

    private WorkflowFixture fixture;
    private ReviewQueueService service;

    @BeforeEach
    void setUp() {
        fixture = new WorkflowFixture(identifierIssuer, accountActivator);
        service = fixture.queueService;
    }

    @Test
    void entryId_combinesApplicationAndLevel() {
        assertThat(ReviewQueueService.entryId("APP-42", 2)).isEqualTo("APP-42-L2");
    }

    @Test
    void submit_createsPendingEntryWithSlaFromLevel() {
        Application app = fixture.submitted(ApplicationKind.FARMER_REGISTRATION);

        List<QueueEntry> queue = service.list(1, QueueFilter.none());

        assertThat(queue).hasSize(1);
        QueueEntry entry = queue.get(0);
        assertThat(entry.getEntryId()).isEqualTo(app.getApplicationId() + "-L1");
        assertThat(entry.getStatus()).isEqualTo(QueueEntryStatus.PENDING);
        assertThat(entry.getAssignedTo()).isNull();
        assertThat(entry.getSlaDeadline())
                .isEqualTo(WorkflowFixture.START.plus(Duration.ofDays(7)).toEpochMilli());
        assertThat(entry.getConstituency()).isEqualTo(CONSTITUENCY);
    }

    @Test
    void enqueue_suggestsLeastLoadedEligibleReviewerButLeavesEntryPending() {
        Application first = fixture.submitted(ApplicationKind.FARMER_REGISTRATION);
        service.claim(first.getApplicationId() + "-L1", CONSTITUENCY_OFFICER);

        Application second = fixture.submitted(ApplicationKind.FARMER_REGISTRATION);

        QueueEntry firstEntry = fixture.record(first.getApplicationId()).findLiveEntry(1);
        QueueEntry secondEntry = fixture.record(second.getApplicationId()).findLiveEntry(1);
        assertThat(firstEntry.getSuggestedAssignee()).isEqualTo(CONSTITUENCY_OFFICER);
        assertThat(secondEntry.getSuggestedAssignee()).isEqualTo(SECOND_CONSTITUENCY_OFFICER);
        assertThat(secondEntry.getStatus()).isEqualTo(QueueEntryStatus.PENDING);
        assertThat(secondEntry.getAssignedTo()).isNull();

        QueueEntry claimed = service.claim(secondEntry.getEntryId(), CONSTITUENCY_OFFICER);
        assertThat(claimed.getAssignedTo()).isEqualTo(CONSTITUENCY_OFFICER);
    }

    @Test
    void suggestAssignee_usesReviewersOfTheLevelOnly() {
        Application app = createApplication("APP-1");

        assertThat(service.suggestAssignee(app, 2)).isEqualTo(REGIONAL_OFFICER);
        assertThat(service.suggestAssignee(app, 3)).isEqualTo(NATIONAL_OFFICER);
    }

    @Test
    void suggestAssignee_nobodyCoversJurisdiction_returnsNull() {
        Application app = createApplication("APP-1").toBuilder()
                .region("Volta")
                .constituency("Keta")
                .build();

        assertThat(service.suggestAssignee(app, 1)).isNull();
    }

    @Test
    void enqueue_liveEntryAtLevel_throwsDuplicateEntry() {
        Application app = fixture.submitted(ApplicationKind.FARMER_REGISTRATION);
        ApplicationRecord record = fixture.record(app.getApplicationId());

        assertThatThrownBy(() -> service.enqueue(record, 1, 7, fixture.clock.millis()))
                .isInstanceOf(DuplicateEntryException.class);
        assertThat(record.getQueueEntries()).hasSize(1);
    }

    @Test
    void complete_noLiveEntry_isNoOp() {
        Application app = fixture.submitted(ApplicationKind.FARMER_REGISTRATION);
        ApplicationRecord record = fixture.record(app.getApplicationId());

        assertThat(service.complete(record, 1, 10L)).isNotNull();
        assertThat(service.complete(record, 1, 20L)).isNull();
        assertThat(record.getQueueEntries().get(0).getCompletedAt()).isEqualTo(10L);
    }

    @Test
    void claim_authorizedReviewer_assignsEntryAndAudits() {
        Application app = fixture.submitted(ApplicationKind.FARMER_REGISTRATION);
        String entryId = ReviewQueueService.entryId(app.getApplicationId(), 1);

        QueueEntry claimed = service.claim(entryId, CONSTITUENCY_OFFICER);

        assertThat(claimed.getStatus()).isEqualTo(QueueEntryStatus.CLAIMED);
        assertThat(claimed.getAssignedTo()).isEqualTo(CONSTITUENCY_OFFICER);
        assertThat(claimed.getClaimedAt()).isEqualTo(fixture.clock.millis());
        assertThat(fixture.auditLog.trail(app.getApplicationId()))
                .extracting(ReviewAction::getAction)
                .containsExactly(ReviewActionType.SUBMITTED, ReviewActionType.CLAIMED);
        assertThat(fixture.counter("review.claim.count", "outcome", "success")).isEqualTo(1.0);
    }

    @Test
    void claim_alreadyClaimed_throwsAlreadyClaimed() {
        Application app = fixture.submitted(ApplicationKind.FARMER_REGISTRATION);
        String entryId = ReviewQueueService.entryId(app.getApplicationId(), 1);
        service.claim(entryId, CONSTITUENCY_OFFICER);

        assertThatThrownBy(() -> service.claim(entryId, SECOND_CONSTITUENCY_OFFICER))
                .isInstanceOf(AlreadyClaimedException.class);
        assertThat(fixture.counter("review.claim.count", "outcome", "already_claimed")).isEqualTo(1.0);
    }

    @Test
    void claim_reviewerOutsideJurisdiction_refusedAndRecordedAsViolation() {
        Application app = fixture.submitted(ApplicationKind.FARMER_REGISTRATION);
        String entryId = ReviewQueueService.entryId(app.getApplicationId(), 1);

        assertThatThrownBy(() -> service.claim(entryId, OTHER_CONSTITUENCY_OFFICER))
                .isInstanceOf(UnauthorizedActionException.class);

        ApplicationRecord record = fixture.record(app.getApplicationId());
        assertThat(record.findLiveEntry(1).getStatus()).isEqualTo(QueueEntryStatus.PENDING);
        assertThat(record.getAuditTrail()).extracting(ReviewAction::getAction)
                .containsExactly(ReviewActionType.SUBMITTED, ReviewActionType.POLICY_VIOLATION);
    }

    @Test
    void claim_unknownReviewer_refused() {
        Application app = fixture.submitted(ApplicationKind.FARMER_REGISTRATION);

        assertThatThrownBy(() -> service.claim(ReviewQueueService.entryId(app.getApplicationId(), 1), "stranger"))
                .isInstanceOf(UnauthorizedActionException.class);
    }

    @Test
    void claim_unknownEntry_throwsNotFound() {
        assertThatThrownBy(() -> service.claim("APP-MISSING-L1", CONSTITUENCY_OFFICER))
                .isInstanceOf(QueueEntryNotFoundException.class);
        assertThatThrownBy(() -> service.claim("not-an-entry", CONSTITUENCY_OFFICER))
                .isInstanceOf(QueueEntryNotFoundException.class);
    }

    @Test
    void claim_concurrentReviewers_exactlyOneSucceeds() throws Exception {
        Application app = fixture.submitted(ApplicationKind.FARMER_REGISTRATION);
        String entryId = ReviewQueueService.entryId(app.getApplicationId(), 1);
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                String reviewer = i % 2 == 0 ? CONSTITUENCY_OFFICER : SECOND_CONSTITUENCY_OFFICER;
                Callable<Boolean> attempt = () -> {
                    start.await();
                    try {
                        service.claim(entryId, reviewer);
                        return true;
                    } catch (AlreadyClaimedException e) {
                        return false;
                    }
                };
                results.add(executor.submit(attempt));
            }
            start.countDown();

            int successes = 0;
            for (Future<Boolean> result : results) {
                if (result.get(10, TimeUnit.SECONDS)) successes++;
            }
            assertThat(successes).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }

        ApplicationRecord record = fixture.record(app.getApplicationId());
        assertThat(record.getAuditTrail()).filteredOn(a -> a.getAction() == ReviewActionType.CLAIMED).hasSize(1);
        assertThat(record.findLiveEntry(1).getAssignedTo()).isIn(CONSTITUENCY_OFFICER, SECOND_CONSTITUENCY_OFFICER);
    }

    @Test
    void release_byHolder_returnsEntryToPool() {
        Application app = fixture.submitted(ApplicationKind.FARMER_REGISTRATION);
        String entryId = ReviewQueueService.entryId(app.getApplicationId(), 1);
        service.claim(entryId, CONSTITUENCY_OFFICER);

        QueueEntry released = service.release(entryId, CONSTITUENCY_OFFICER);

        assertThat(released.getStatus()).isEqualTo(QueueEntryStatus.PENDING);
        assertThat(released.getAssignedTo()).isNull();
        assertThat(service.claim(entryId, SECOND_CONSTITUENCY_OFFICER).getAssignedTo())
                .isEqualTo(SECOND_CONSTITUENCY_OFFICER);
    }

    @Test
    void release_byOtherReviewer_throwsNotClaimedByCaller() {
        Application app = fixture.submitted(ApplicationKind.FARMER_REGISTRATION);
        String entryId = ReviewQueueService.entryId(app.getApplicationId(), 1);
        service.claim(entryId, CONSTITUENCY_OFFICER);

        assertThatThrownBy(() -> service.release(entryId, SECOND_CONSTITUENCY_OFFICER))
                .isInstanceOf(NotClaimedByCallerException.class);
    }

    @Test
    void release_unclaimedEntry_throwsNotClaimedByCaller() {
        Application app = fixture.submitted(ApplicationKind.FARMER_REGISTRATION);

        assertThatThrownBy(() -> service.release(ReviewQueueService.entryId(app.getApplicationId(), 1),
                CONSTITUENCY_OFFICER)).isInstanceOf(NotClaimedByCallerException.class);
    }

    @Test
    void release_afterChangesRequested_throwsInvalidState() {
        Application app = fixture.submitted(ApplicationKind.FARMER_REGISTRATION);
        String entryId = ReviewQueueService.entryId(app.getApplicationId(), 1);
        service.claim(entryId, CONSTITUENCY_OFFICER);
        fixture.workflowService.requestChanges(app.getApplicationId(), CONSTITUENCY_OFFICER, 1,
                "Upload a clearer farm photo", null);

        assertThatThrownBy(() -> service.release(entryId, CONSTITUENCY_OFFICER))
                .isInstanceOf(InvalidStateException.class);
    }

    @Test
    void reassign_bySupervisor_movesEntryToNewReviewer() {
        Application app = fixture.submitted(ApplicationKind.FARMER_REGISTRATION);
        String entryId = ReviewQueueService.entryId(app.getApplicationId(), 1);
        service.claim(entryId, CONSTITUENCY_OFFICER);

        QueueEntry reassigned = service.reassign(entryId, SUPERVISOR, SECOND_CONSTITUENCY_OFFICER);

        assertThat(reassigned.getAssignedTo()).isEqualTo(SECOND_CONSTITUENCY_OFFICER);
        assertThat(reassigned.getStatus()).isEqualTo(QueueEntryStatus.CLAIMED);
        ReviewAction last = lastAction(app.getApplicationId());
        assertThat(last.getAction()).isEqualTo(ReviewActionType.REASSIGNED);
        assertThat(last.getReviewerId()).isEqualTo(SUPERVISOR);
        assertThat(last.getNotes()).isEqualTo("from officer-ayawaso to officer-ayawaso-2");
    }

    @Test
    void reassign_pendingEntry_becomesClaimed() {
        Application app = fixture.submitted(ApplicationKind.FARMER_REGISTRATION);
        String entryId = ReviewQueueService.entryId(app.getApplicationId(), 1);

        QueueEntry reassigned = service.reassign(entryId, SUPERVISOR, CONSTITUENCY_OFFICER);

        assertThat(reassigned.getStatus()).isEqualTo(QueueEntryStatus.CLAIMED);
        assertThat(lastAction(app.getApplicationId()).getNotes()).isEqualTo("from unassigned to officer-ayawaso");
    }

    @Test
    void reassign_byNonSupervisor_refusedAndRecorded() {
        Application app = fixture.submitted(ApplicationKind.FARMER_REGISTRATION);
        String entryId = ReviewQueueService.entryId(app.getApplicationId(), 1);
        service.claim(entryId, CONSTITUENCY_OFFICER);

        assertThatThrownBy(() -> service.reassign(entryId, CONSTITUENCY_OFFICER, SECOND_CONSTITUENCY_OFFICER))
                .isInstanceOf(UnauthorizedActionException.class);
        assertThat(lastAction(app.getApplicationId()).getAction()).isEqualTo(ReviewActionType.POLICY_VIOLATION);
        assertThat(fixture.record(app.getApplicationId()).findLiveEntry(1).getAssignedTo())
                .isEqualTo(CONSTITUENCY_OFFICER);
    }

    @Test
    void reassign_toReviewerOutsideJurisdiction_refused() {
        Application app = fixture.submitted(ApplicationKind.FARMER_REGISTRATION);

        assertThatThrownBy(() -> service.reassign(ReviewQueueService.entryId(app.getApplicationId(), 1),
                SUPERVISOR, OTHER_CONSTITUENCY_OFFICER)).isInstanceOf(UnauthorizedActionException.class);
    }

    @Test
    void list_ordersByPriorityAndAppliesFilters() {
        Application plain = fixture.submitted(ApplicationKind.FARMER_REGISTRATION);
        ApplicationDraft verified = createDraft(ApplicationKind.FARMER_REGISTRATION);
        verified.setSnapshot(verified.getSnapshot().toBuilder().phoneVerified(true).build());
        Application priority = fixture.workflowService.submit(
                fixture.workflowService.createDraft(verified).getApplicationId());
        ApplicationDraft elsewhere = createDraft(ApplicationKind.FARMER_REGISTRATION);
        elsewhere.setConstituency("Tema East");
        Application temaApp = fixture.workflowService.submit(
                fixture.workflowService.createDraft(elsewhere).getApplicationId());

        List<QueueEntry> all = service.list(1, QueueFilter.none());
        assertThat(all).extracting(QueueEntry::getApplicationId).first().isEqualTo(priority.getApplicationId());
        assertThat(all).hasSize(3);

        List<QueueEntry> ayawaso = service.list(1, QueueFilter.builder().constituency("AYAWASO WEST").build());
        assertThat(ayawaso).extracting(QueueEntry::getApplicationId)
                .containsExactly(priority.getApplicationId(), plain.getApplicationId())
                .doesNotContain(temaApp.getApplicationId());
    }

    @Test
    void list_otherLevel_isEmpty() {
        fixture.submitted(ApplicationKind.FARMER_REGISTRATION);

        assertThat(service.list(2, null)).isEmpty();
    }

    @Test
    void escalateOverdue_flagsOnceAndNotifiesSupervisors() {
        Application app = fixture.submitted(ApplicationKind.FARMER_REGISTRATION);
        String entryId = ReviewQueueService.entryId(app.getApplicationId(), 1);

        assertThat(service.escalateOverdue(entryId)).isFalse();

        fixture.clock.advance(Duration.ofDays(8));
        assertThat(service.escalateOverdue(entryId)).isTrue();
        assertThat(service.escalateOverdue(entryId)).isFalse();

        ApplicationRecord record = fixture.record(app.getApplicationId());
        assertThat(record.findLiveEntry(1).isEscalated()).isTrue();
        assertThat(record.getAuditTrail()).filteredOn(a -> a.getAction() == ReviewActionType.ESCALATED).hasSize(1);
        assertThat(fixture.notifier.events()).containsOnlyOnce(NotificationEvent.QUEUE_ENTRY_ESCALATED);
        assertThat(service.list(1, QueueFilter.builder().escalatedOnly(true).build())).hasSize(1);
    }

    @Test
    void stats_countsEntriesByStatus() {
        Application first = fixture.submitted(ApplicationKind.FARMER_REGISTRATION);
        fixture.submitted(ApplicationKind.FARMER_REGISTRATION);
        service.claim(ReviewQueueService.entryId(first.getApplicationId(), 1), CONSTITUENCY_OFFICER);
        fixture.clock.advance(Duration.ofDays(8));

        Map<String, Integer> stats = service.stats(1);

        assertThat(stats).containsEntry("pending", 1)
                .containsEntry("claimed", 1)
                .containsEntry("inProgress", 0)
                .containsEntry("completed", 0)
                .containsEntry("overdue", 2)
                .containsEntry("escalated", 0);
    }

    private ReviewAction lastAction(String applicationId) {
        List<ReviewAction> trail = fixture.auditLog.trail(applicationId);
        return trail.get(trail.size() - 1);
    }
}
