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
@Schema(description = "Role and jurisdiction of a reviewing user")
public class ReviewerProfile {

    @Schema(example = "officer-ayawaso")
    private String userId;

    @Schema(example = "CONSTITUENCY_OFFICER")
    private ReviewerRole role;

    @Schema(example = "Greater Accra")
    private String region;

    @Schema(example = "Accra Metropolitan")
    private String district;

    @Schema(example = "Ayawaso West")
    private String constituency;
}
