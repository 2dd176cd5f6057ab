package com.poultry.review.engine.checks;

import com.poultry.review.engine.EligibilityCheck;
import com.poultry.review.engine.EligibilityCheckType;
import com.poultry.review.engine.ScreeningContext;
import com.poultry.review.model.CheckResult;
import com.poultry.review.model.ProgramRules;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ExistingBeneficiaryCheck implements EligibilityCheck {

    public static final String FLAG = "EXISTING_BENEFICIARY";

    @Override
    public EligibilityCheckType getCheckType() {
        return EligibilityCheckType.EXISTING_BENEFICIARY;
    }

    @Override
    public CheckResult evaluate(ScreeningContext context, ProgramRules rules) {
        if (!context.getSnapshot().isExistingBeneficiary()) {
            return CheckResult.neutral(getCheckType().name());
        }
        return CheckResult.builder()
                .checkName(getCheckType().name())
                .delta(rules.getExistingBeneficiaryBonus())
                .flags(List.of(FLAG))
                .build();
    }
}
