package com.poultry.review.engine.checks;

import com.poultry.review.engine.EligibilityCheck;
import com.poultry.review.engine.EligibilityCheckType;
import com.poultry.review.engine.ScreeningContext;
import com.poultry.review.model.CheckResult;
import com.poultry.review.model.ProgramRules;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Penalizes each mandatory document the applicant did not supply.
 * Document codes are compared case-insensitively.
 */
@Component
public class MandatoryDocumentCheck implements EligibilityCheck {

    public static final String FLAG_PREFIX = "MISSING_DOCUMENT:";

    @Override
    public EligibilityCheckType getCheckType() {
        return EligibilityCheckType.MANDATORY_DOCUMENTS;
    }

    @Override
    public CheckResult evaluate(ScreeningContext context, ProgramRules rules) {
        List<String> supplied = context.getSnapshot().getDocuments();
        Set<String> have = supplied == null ? Set.of() : supplied.stream()
                .map(d -> d.toUpperCase(Locale.ROOT))
                .collect(Collectors.toSet());

        List<String> flags = new ArrayList<>();
        for (String required : rules.getMandatoryDocuments()) {
            if (!have.contains(required.toUpperCase(Locale.ROOT))) {
                flags.add(FLAG_PREFIX + required);
            }
        }

        return CheckResult.builder()
                .checkName(getCheckType().name())
                .delta(-rules.getMissingDocumentPenalty() * flags.size())
                .flags(flags)
                .build();
    }
}
