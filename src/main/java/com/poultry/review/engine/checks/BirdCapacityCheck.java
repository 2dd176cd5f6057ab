package com.poultry.review.engine.checks;

import com.poultry.review.engine.EligibilityCheck;
import com.poultry.review.engine.EligibilityCheckType;
import com.poultry.review.engine.ScreeningContext;
import com.poultry.review.model.CheckResult;
import com.poultry.review.model.ProgramRules;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class BirdCapacityCheck implements EligibilityCheck {

    @Override
    public EligibilityCheckType getCheckType() {
        return EligibilityCheckType.BIRD_CAPACITY;
    }

    @Override
    public CheckResult evaluate(ScreeningContext context, ProgramRules rules) {
        Integer capacity = context.getSnapshot().getBirdCapacity();
        if (capacity == null) {
            return CheckResult.neutral(getCheckType().name());
        }
        String flag = null;
        if (rules.getMinBirdCapacity() != null && capacity < rules.getMinBirdCapacity()) {
            flag = "CAPACITY_BELOW_MINIMUM";
        } else if (rules.getMaxBirdCapacity() != null && capacity > rules.getMaxBirdCapacity()) {
            flag = "CAPACITY_ABOVE_MAXIMUM";
        }
        if (flag == null) {
            return CheckResult.neutral(getCheckType().name());
        }
        return CheckResult.builder()
                .checkName(getCheckType().name())
                .delta(-rules.getBirdCapacityPenalty())
                .flags(List.of(flag))
                .build();
    }
}
