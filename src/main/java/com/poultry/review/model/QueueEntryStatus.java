package com.poultry.review.model;

public enum QueueEntryStatus {
    PENDING,
    CLAIMED,
    IN_PROGRESS,
    COMPLETED;

    public boolean isLive() {
        return this != COMPLETED;
    }
}
