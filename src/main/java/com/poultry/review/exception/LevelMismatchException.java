package com.poultry.review.exception;

public class LevelMismatchException extends ReviewWorkflowException {

    public LevelMismatchException(String applicationId, int requestedLevel, Integer currentLevel) {
        super("LEVEL_MISMATCH",
                String.format("Application %s is not under review at level %d (current level: %s)",
                        applicationId, requestedLevel, currentLevel == null ? "none" : currentLevel));
    }
}
