package com.poultry.review.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One application awaiting review at one level")
public class QueueEntry {

    @Schema(description = "Entry identifier, unique per application and level", example = "APP-7f3c2a9e-L1")
    private String entryId;

    private String applicationId;
    private ApplicationKind kind;

    @Schema(description = "Review level this entry belongs to", example = "1")
    private int reviewLevel;

    private QueueEntryStatus status;

    @Schema(description = "Reviewer holding the claim", example = "officer-ayawaso")
    private String assignedTo;

    @Schema(description = "Least-loaded eligible reviewer when the entry was created; advisory, claiming is still open",
            example = "officer-ayawaso")
    private String suggestedAssignee;

    private long claimedAt;
    private long enteredAt;
    private long completedAt;

    @Schema(description = "Advisory completion target (epoch millis)")
    private long slaDeadline;

    @Schema(description = "Ranking score; refreshed every time the queue is listed", example = "130")
    private int priorityScore;

    // Copied from the application for filtering and tie-breaking
    private String region;
    private String district;
    private String constituency;
    private long submittedAt;

    private boolean escalated;
    private long escalatedAt;
}
