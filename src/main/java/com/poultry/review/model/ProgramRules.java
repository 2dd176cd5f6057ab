package com.poultry.review.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Eligibility rule table for one application kind. Every check reads its
 * parameters and point delta from here; null bounds disable the check.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Eligibility rule table used to screen submissions")
public class ProgramRules {

    @Builder.Default
    private int baseScore = 50;

    @Schema(description = "Minimum score for an application to enter review", example = "50")
    @Builder.Default
    private int passThreshold = 50;

    @Schema(description = "Program tracks that earn the sponsored-track bonus", example = "[\"YEA_BROILER\", \"YEA_LAYER\"]")
    @Builder.Default
    private List<String> sponsoredTracks = new ArrayList<>();

    @Builder.Default
    private int trackMatchBonus = 50;

    @Schema(example = "[\"GHANA_CARD\", \"FARM_PHOTOS\"]")
    @Builder.Default
    private List<String> mandatoryDocuments = new ArrayList<>();

    @Builder.Default
    private int missingDocumentPenalty = 40;

    @Schema(example = "18")
    private Integer minAge;

    @Schema(example = "65")
    private Integer maxAge;

    @Builder.Default
    private int agePenalty = 30;

    @Schema(description = "Submission deadline (epoch millis); 0 means open-ended")
    private long applicationDeadline;

    @Builder.Default
    private int lateSubmissionPenalty = 50;

    @Schema(description = "Remaining program places; null means unlimited", example = "120")
    private Integer slotsAvailable;

    @Builder.Default
    private int capacityPenalty = 50;

    @Schema(description = "Constituencies the program runs in; empty means nationwide")
    @Builder.Default
    private List<String> eligibleConstituencies = new ArrayList<>();

    @Builder.Default
    private int constituencyPenalty = 40;

    private Integer minBirdCapacity;

    private Integer maxBirdCapacity;

    @Builder.Default
    private int birdCapacityPenalty = 20;

    @Builder.Default
    private int existingBeneficiaryBonus = 10;
}
