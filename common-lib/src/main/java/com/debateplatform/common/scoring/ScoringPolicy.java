package com.debateplatform.common.scoring;

import java.util.Objects;

/**
 * Parameters of {@link DisagreementScorer}.
 *
 * @param aggregation          how both confidences combine
 * @param lowConfidenceFloor   a debater below this confidence triggers the penalty [0.0–1.0]
 * @param lowConfidencePenalty multiplier applied to the aggregate when the penalty fires (0.0–1.0]
 */
public record ScoringPolicy(
    ConfidenceAggregation aggregation,
    double lowConfidenceFloor,
    double lowConfidencePenalty
) {
    public static final ScoringPolicy DEFAULT = new ScoringPolicy(ConfidenceAggregation.MINIMUM, 0.4, 0.5);

    public ScoringPolicy {
        Objects.requireNonNull(aggregation, "aggregation");
        if (lowConfidenceFloor < 0.0 || lowConfidenceFloor > 1.0) {
            throw new IllegalArgumentException("lowConfidenceFloor must be within [0, 1], was " + lowConfidenceFloor);
        }
        if (lowConfidencePenalty <= 0.0 || lowConfidencePenalty > 1.0) {
            throw new IllegalArgumentException("lowConfidencePenalty must be within (0, 1], was " + lowConfidencePenalty);
        }
    }
}
