package com.poultry.review.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "An application routed through the multi-tier review workflow")
public class Application {

    @Schema(description = "Unique application identifier", example = "APP-7f3c2a9e")
    private String applicationId;

    @Schema(description = "User who owns the application", example = "farmer-1001")
    private String applicantId;

    @Schema(description = "Which review flow the application follows", example = "FARMER_REGISTRATION")
    private ApplicationKind kind;

    @Schema(description = "Workflow status", example = "UNDER_REVIEW")
    private ApplicationStatus status;

    @Schema(description = "Review level (1..N) currently responsible; null when not in review", example = "1")
    private Integer currentReviewLevel;

    @Schema(example = "Greater Accra")
    private String region;

    @Schema(example = "Accra Metropolitan")
    private String district;

    @Schema(example = "Ayawaso West")
    private String constituency;

    private ApplicantSnapshot snapshot;

    @Schema(description = "Eligibility score computed at submission (0-100)", example = "80")
    private Integer eligibilityScore;

    @Schema(description = "Eligibility reason codes", example = "[\"PROGRAM_TRACK_MATCH\"]")
    @Builder.Default
    private List<String> eligibilityFlags = new ArrayList<>();

    private long createdAt;

    private long submittedAt;       // 0 while DRAFT

    private long finalDecisionAt;   // 0 until a terminal status

    @Schema(description = "Changes the applicant was asked to make")
    private String changesRequested;

    @Schema(description = "Epoch millis by which the applicant must resubmit; 0 when none outstanding")
    private long changesDeadline;

    private String rejectionReason;

    @Schema(description = "Identifier minted on final approval", example = "YEA-GREA-AYAW-0001")
    private String issuedIdentifier;
}
