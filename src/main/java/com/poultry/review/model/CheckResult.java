package com.poultry.review.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Contribution of a single eligibility check: a signed point delta and the
 * reason codes explaining it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckResult {

    private String checkName;

    private int delta;

    @Builder.Default
    private List<String> flags = new ArrayList<>();

    public static CheckResult neutral(String checkName) {
        return CheckResult.builder().checkName(checkName).delta(0).build();
    }
}
