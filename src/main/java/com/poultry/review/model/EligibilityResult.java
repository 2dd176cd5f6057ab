package com.poultry.review.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outcome of the eligibility screen run at submission")
public class EligibilityResult {

    @Schema(description = "Suitability score, clamped to 0-100", example = "80")
    private int score;

    @Schema(description = "Reason codes from every check that fired",
            example = "[\"PROGRAM_TRACK_MATCH\", \"MISSING_DOCUMENT:FARM_PHOTOS\"]")
    @Builder.Default
    private List<String> flags = new ArrayList<>();

    @Schema(description = "Whether the score reached the pass threshold", example = "true")
    private boolean passed;
}
