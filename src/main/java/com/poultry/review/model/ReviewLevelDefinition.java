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
@Schema(description = "One tier of the approval chain")
public class ReviewLevelDefinition {

    @Schema(example = "constituency")
    private String name;

    @Schema(description = "Days allowed at this level before the entry is overdue", example = "7")
    private int slaDays;

    @Schema(description = "Reviewer roles allowed to act at this level", example = "[\"CONSTITUENCY_OFFICER\"]")
    @Builder.Default
    private List<ReviewerRole> requiredRoles = new ArrayList<>();

    @Schema(description = "Jurisdiction the reviewer must share with the application", example = "CONSTITUENCY")
    private JurisdictionScope scope;
}
