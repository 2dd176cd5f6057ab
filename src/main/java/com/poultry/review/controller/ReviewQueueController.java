package com.poultry.review.controller;

import com.poultry.review.model.ApplicationKind;
import com.poultry.review.model.QueueEntry;
import com.poultry.review.model.QueueFilter;
import com.poultry.review.service.ReviewQueueService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

import static com.poultry.review.controller.RequestBodies.requireString;

@RestController
@RequestMapping("/api/v1/review")
@Tag(name = "Review Queue", description = "Per-level review queues with claim, release and supervisory reassignment")
public class ReviewQueueController {

    private final ReviewQueueService reviewQueueService;

    public ReviewQueueController(ReviewQueueService reviewQueueService) {
        this.reviewQueueService = reviewQueueService;
    }

    @GetMapping("/queue")
    @Operation(summary = "List a review level's queue",
               description = "Pending, claimed and in-progress entries at the level, highest priority first. "
                       + "Priority is recomputed on every call.")
    public ResponseEntity<List<QueueEntry>> getQueue(
            @RequestParam int level,
            @RequestParam(required = false) String region,
            @RequestParam(required = false) String district,
            @RequestParam(required = false) String constituency,
            @RequestParam(required = false) String assignedTo,
            @RequestParam(required = false) ApplicationKind kind,
            @RequestParam(defaultValue = "false") boolean escalatedOnly) {
        QueueFilter filter = QueueFilter.builder()
                .region(region)
                .district(district)
                .constituency(constituency)
                .assignedTo(assignedTo)
                .kind(kind)
                .escalatedOnly(escalatedOnly)
                .build();
        return ResponseEntity.ok(reviewQueueService.list(level, filter));
    }

    @PostMapping("/queue/{entryId}/claim")
    @Operation(summary = "Claim a pending entry",
               description = "Body: reviewerId. Exactly one of several concurrent claims succeeds; the rest get 409 ALREADY_CLAIMED.")
    public ResponseEntity<QueueEntry> claim(@PathVariable String entryId,
                                            @RequestBody Map<String, Object> body) {
        return ResponseEntity.ok(reviewQueueService.claim(entryId, requireString(body, "reviewerId")));
    }

    @PostMapping("/queue/{entryId}/release")
    @Operation(summary = "Release a claimed entry", description = "Body: reviewerId (must be the current holder).")
    public ResponseEntity<QueueEntry> release(@PathVariable String entryId,
                                              @RequestBody Map<String, Object> body) {
        return ResponseEntity.ok(reviewQueueService.release(entryId, requireString(body, "reviewerId")));
    }

    @PostMapping("/queue/{entryId}/reassign")
    @Operation(summary = "Reassign an entry", description = "Body: supervisorId, reviewerId. Supervisors and admins only.")
    public ResponseEntity<QueueEntry> reassign(@PathVariable String entryId,
                                               @RequestBody Map<String, Object> body) {
        return ResponseEntity.ok(reviewQueueService.reassign(entryId,
                requireString(body, "supervisorId"), requireString(body, "reviewerId")));
    }

    @GetMapping("/stats")
    @Operation(summary = "Get queue statistics for a level",
               description = "Counts by entry status plus overdue and escalated live entries")
    public ResponseEntity<Map<String, Integer>> getStats(@RequestParam int level) {
        return ResponseEntity.ok(reviewQueueService.stats(level));
    }
}
