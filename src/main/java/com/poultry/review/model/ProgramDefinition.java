package com.poultry.review.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything that distinguishes one application kind from another: the
 * eligibility rules, the ordered approval chain and the terminal actions.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Eligibility rules, review levels and terminal actions for one application kind")
public class ProgramDefinition {

    private ProgramRules rules;

    @Schema(description = "Review levels in order; level 1 is the first element")
    @Builder.Default
    private List<ReviewLevelDefinition> levels = new ArrayList<>();

    @Schema(description = "Activate the applicant's account or enrollment on final approval", example = "true")
    private boolean activateAccount;

    @Schema(description = "Prefix of identifiers issued on final approval", example = "FRM")
    private String identifierPrefix;

    public ReviewLevelDefinition level(int level) {
        if (level < 1 || level > levels.size()) {
            return null;
        }
        return levels.get(level - 1);
    }

    public int levelCount() {
        return levels.size();
    }
}
