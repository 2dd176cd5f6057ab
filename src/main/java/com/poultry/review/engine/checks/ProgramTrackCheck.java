package com.poultry.review.engine.checks;

import com.poultry.review.engine.EligibilityCheck;
import com.poultry.review.engine.EligibilityCheckType;
import com.poultry.review.engine.ScreeningContext;
import com.poultry.review.model.CheckResult;
import com.poultry.review.model.ProgramRules;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Awards the track bonus when the applicant applies for one of the
 * program's sponsored tracks (e.g. YEA broiler or layer production).
 */
@Component
public class ProgramTrackCheck implements EligibilityCheck {

    public static final String FLAG = "PROGRAM_TRACK_MATCH";

    @Override
    public EligibilityCheckType getCheckType() {
        return EligibilityCheckType.PROGRAM_TRACK;
    }

    @Override
    public CheckResult evaluate(ScreeningContext context, ProgramRules rules) {
        String track = context.getSnapshot().getProgramTrack();
        if (track == null) {
            return CheckResult.neutral(getCheckType().name());
        }
        boolean sponsored = rules.getSponsoredTracks().stream().anyMatch(track::equalsIgnoreCase);
        if (!sponsored) {
            return CheckResult.neutral(getCheckType().name());
        }
        return CheckResult.builder()
                .checkName(getCheckType().name())
                .delta(rules.getTrackMatchBonus())
                .flags(List.of(FLAG))
                .build();
    }
}
