package com.poultry.review.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * An application together with its queue entries and audit trail.
 * This is the unit that is read and conditionally written as a whole, so a
 * state change, its queue update and its audit row commit together or not at all.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApplicationRecord {

    private Application application;

    @Builder.Default
    private List<QueueEntry> queueEntries = new ArrayList<>();

    @Builder.Default
    private List<ReviewAction> auditTrail = new ArrayList<>();

    // Store generation the record was read at; the next write must match it
    private long version;

    /**
     * The live (not completed) entry at a level, or null.
     */
    public QueueEntry findLiveEntry(int level) {
        return queueEntries.stream()
                .filter(e -> e.getReviewLevel() == level && e.getStatus().isLive())
                .findFirst()
                .orElse(null);
    }

    public QueueEntry findEntry(String entryId) {
        return queueEntries.stream()
                .filter(e -> e.getEntryId().equals(entryId))
                .findFirst()
                .orElse(null);
    }

    public List<QueueEntry> liveEntries() {
        return queueEntries.stream()
                .filter(e -> e.getStatus().isLive())
                .toList();
    }
}
