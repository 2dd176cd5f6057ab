package com.poultry.review.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Applicant and farm attributes judged by the review; frozen at submission except through resubmit")
public class ApplicantSnapshot {

    @Schema(description = "Applicant full name", example = "Ama Mensah")
    private String applicantName;

    @Schema(description = "Contact email", example = "ama.mensah@example.com")
    private String email;

    @Schema(description = "Contact phone", example = "+233201234567")
    private String phone;

    private boolean emailVerified;

    private boolean phoneVerified;

    @Schema(description = "Applicant age in years", example = "29")
    private Integer applicantAge;

    @Schema(description = "Program track applied for", example = "YEA_BROILER")
    private String programTrack;

    @Schema(description = "Codes of the documents supplied", example = "[\"GHANA_CARD\", \"FARM_PHOTOS\"]")
    @Builder.Default
    private List<String> documents = new ArrayList<>();

    @Schema(description = "Years of poultry experience", example = "3")
    private int yearsExperience;

    @Schema(description = "Current or planned bird capacity", example = "500")
    private Integer birdCapacity;

    @Schema(description = "Already a government-sponsored beneficiary", example = "false")
    private boolean existingBeneficiary;

    @Builder.Default
    private Map<String, String> attributes = new HashMap<>();
}
