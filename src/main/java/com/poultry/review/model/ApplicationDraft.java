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
@Schema(description = "Request body for creating a draft application")
public class ApplicationDraft {

    @Schema(example = "farmer-1001")
    private String applicantId;

    @Schema(example = "FARMER_REGISTRATION")
    private ApplicationKind kind;

    @Schema(example = "Greater Accra")
    private String region;

    @Schema(example = "Accra Metropolitan")
    private String district;

    @Schema(example = "Ayawaso West")
    private String constituency;

    private ApplicantSnapshot snapshot;
}
