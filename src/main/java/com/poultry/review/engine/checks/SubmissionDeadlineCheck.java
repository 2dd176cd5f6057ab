package com.poultry.review.engine.checks;

import com.poultry.review.engine.EligibilityCheck;
import com.poultry.review.engine.EligibilityCheckType;
import com.poultry.review.engine.ScreeningContext;
import com.poultry.review.model.CheckResult;
import com.poultry.review.model.ProgramRules;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class SubmissionDeadlineCheck implements EligibilityCheck {

    public static final String FLAG = "SUBMISSION_PAST_DEADLINE";

    @Override
    public EligibilityCheckType getCheckType() {
        return EligibilityCheckType.SUBMISSION_DEADLINE;
    }

    @Override
    public CheckResult evaluate(ScreeningContext context, ProgramRules rules) {
        long deadline = rules.getApplicationDeadline();
        if (deadline <= 0 || context.getSubmittedAt() <= deadline) {
            return CheckResult.neutral(getCheckType().name());
        }
        return CheckResult.builder()
                .checkName(getCheckType().name())
                .delta(-rules.getLateSubmissionPenalty())
                .flags(List.of(FLAG))
                .build();
    }
}
