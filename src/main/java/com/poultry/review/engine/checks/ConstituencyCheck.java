package com.poultry.review.engine.checks;

import com.poultry.review.engine.EligibilityCheck;
import com.poultry.review.engine.EligibilityCheckType;
import com.poultry.review.engine.ScreeningContext;
import com.poultry.review.model.CheckResult;
import com.poultry.review.model.ProgramRules;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Penalizes applicants outside the constituencies a program runs in.
 * An empty list means the program is nationwide.
 */
@Component
public class ConstituencyCheck implements EligibilityCheck {

    public static final String FLAG = "CONSTITUENCY_NOT_ELIGIBLE";

    @Override
    public EligibilityCheckType getCheckType() {
        return EligibilityCheckType.CONSTITUENCY;
    }

    @Override
    public CheckResult evaluate(ScreeningContext context, ProgramRules rules) {
        List<String> eligible = rules.getEligibleConstituencies();
        if (eligible.isEmpty()) {
            return CheckResult.neutral(getCheckType().name());
        }
        String constituency = context.getConstituency();
        if (constituency != null && eligible.stream().anyMatch(constituency::equalsIgnoreCase)) {
            return CheckResult.neutral(getCheckType().name());
        }
        return CheckResult.builder()
                .checkName(getCheckType().name())
                .delta(-rules.getConstituencyPenalty())
                .flags(List.of(FLAG))
                .build();
    }
}
