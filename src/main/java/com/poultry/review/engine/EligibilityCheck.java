package com.poultry.review.engine;

import com.poultry.review.model.CheckResult;
import com.poultry.review.model.ProgramRules;

/**
 * One rule of the eligibility screen. Implementations are stateless and
 * must return the same result for the same inputs.
 */
public interface EligibilityCheck {

    EligibilityCheckType getCheckType();

    /**
     * @param context snapshot and submission details being screened
     * @param rules   the program's rule table (parameters and point deltas)
     * @return signed point delta and reason codes; a zero delta with no flags when the rule does not apply
     */
    CheckResult evaluate(ScreeningContext context, ProgramRules rules);
}
