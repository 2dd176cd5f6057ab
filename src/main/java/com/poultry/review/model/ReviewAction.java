package com.poultry.review.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One immutable audit row. The audit trail of an application is the ordered
 * list of these rows and is never edited.
 */
@Value
@Builder
@Jacksonized
@Schema(description = "Audit trail entry: who did what, at which level, when")
public class ReviewAction {

    String actionId;

    String applicationId;

    @Schema(description = "Acting user; null for system-generated events", example = "officer-ayawaso")
    String reviewerId;

    @Schema(description = "Review level the action applies to; null before review starts", example = "1")
    Integer reviewLevel;

    ReviewActionType action;

    String notes;

    long createdAt;
}
