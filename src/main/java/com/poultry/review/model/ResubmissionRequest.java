package com.poultry.review.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Applicant's corrected data in answer to a changes request")
public class ResubmissionRequest {

    @Schema(example = "farmer-1001")
    private String applicantId;

    private ApplicantSnapshot snapshot;
}
