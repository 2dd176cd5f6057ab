package com.poultry.review.engine;

import com.poultry.review.model.CheckResult;
import com.poultry.review.model.EligibilityResult;
import com.poultry.review.model.ProgramRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Screens a submission against a program's rule table.
 * Uses the Strategy pattern: each EligibilityCheckType is handled by a registered EligibilityCheck.
 *
 * <p>Score = rules.baseScore + sum of check deltas, clamped to [0, 100].
 * The application passes when the score reaches rules.passThreshold.
 * The scorer holds no state between calls.
 */
@Component
public class EligibilityScorer {

    private static final Logger log = LoggerFactory.getLogger(EligibilityScorer.class);

    private final Map<EligibilityCheckType, EligibilityCheck> checkMap;

    public EligibilityScorer(List<EligibilityCheck> checks) {
        this.checkMap = new EnumMap<>(EligibilityCheckType.class);
        for (EligibilityCheck check : checks) {
            checkMap.put(check.getCheckType(), check);
            log.debug("Registered eligibility check: {} -> {}",
                    check.getCheckType(), check.getClass().getSimpleName());
        }
    }

    public EligibilityResult score(ScreeningContext context, ProgramRules rules) {
        int total = rules.getBaseScore();
        List<String> flags = new ArrayList<>();

        // EnumMap iterates in declaration order, so flags come out in a fixed order
        for (EligibilityCheck check : checkMap.values()) {
            CheckResult result = check.evaluate(context, rules);
            total += result.getDelta();
            flags.addAll(result.getFlags());
        }

        int clamped = Math.max(0, Math.min(100, total));
        return EligibilityResult.builder()
                .score(clamped)
                .flags(flags)
                .passed(clamped >= rules.getPassThreshold())
                .build();
    }
}
