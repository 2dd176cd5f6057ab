package com.poultry.review.engine.checks;

import com.poultry.review.engine.EligibilityCheck;
import com.poultry.review.engine.EligibilityCheckType;
import com.poultry.review.engine.ScreeningContext;
import com.poultry.review.model.CheckResult;
import com.poultry.review.model.ProgramRules;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Penalizes applications to a program that has no places left.
 * A null slot count means the program is not capped.
 */
@Component
public class ProgramCapacityCheck implements EligibilityCheck {

    public static final String FLAG = "PROGRAM_AT_CAPACITY";

    @Override
    public EligibilityCheckType getCheckType() {
        return EligibilityCheckType.PROGRAM_CAPACITY;
    }

    @Override
    public CheckResult evaluate(ScreeningContext context, ProgramRules rules) {
        Integer slots = rules.getSlotsAvailable();
        if (slots == null || slots > 0) {
            return CheckResult.neutral(getCheckType().name());
        }
        return CheckResult.builder()
                .checkName(getCheckType().name())
                .delta(-rules.getCapacityPenalty())
                .flags(List.of(FLAG))
                .build();
    }
}
