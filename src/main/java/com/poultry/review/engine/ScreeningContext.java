package com.poultry.review.engine;

import com.poultry.review.model.ApplicantSnapshot;
import lombok.Builder;
import lombok.Value;

/**
 * Inputs of one eligibility screen: the snapshot under judgement plus the
 * application fields checks need that are not part of the snapshot.
 */
@Value
@Builder
public class ScreeningContext {

    ApplicantSnapshot snapshot;

    String constituency;

    long submittedAt;
}
