package com.poultry.review.engine.checks;

import com.poultry.review.engine.EligibilityCheck;
import com.poultry.review.engine.EligibilityCheckType;
import com.poultry.review.engine.ScreeningContext;
import com.poultry.review.model.CheckResult;
import com.poultry.review.model.ProgramRules;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class AgeRangeCheck implements EligibilityCheck {

    @Override
    public EligibilityCheckType getCheckType() {
        return EligibilityCheckType.AGE_RANGE;
    }

    @Override
    public CheckResult evaluate(ScreeningContext context, ProgramRules rules) {
        Integer age = context.getSnapshot().getApplicantAge();
        if (age == null) {
            return CheckResult.neutral(getCheckType().name());
        }
        if (rules.getMinAge() != null && age < rules.getMinAge()) {
            return penalty(rules, "AGE_BELOW_MINIMUM");
        }
        if (rules.getMaxAge() != null && age > rules.getMaxAge()) {
            return penalty(rules, "AGE_ABOVE_MAXIMUM");
        }
        return CheckResult.neutral(getCheckType().name());
    }

    private CheckResult penalty(ProgramRules rules, String flag) {
        return CheckResult.builder()
                .checkName(getCheckType().name())
                .delta(-rules.getAgePenalty())
                .flags(List.of(flag))
                .build();
    }
}
