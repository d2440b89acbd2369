package com.debateplatform.common.policy;

import com.debateplatform.common.exception.DebateConfigurationException;
import com.debateplatform.common.scoring.ScoringPolicy;

import java.util.Objects;

/**
 * Decision parameters for one {@link com.debateplatform.common.model.DebateKind}.
 *
 * @param disagreementThreshold consensus requires disagreement at or below this [0–100]
 * @param minConfidence         consensus requires aggregate confidence at or above this [0.0–1.0]
 * @param maxRounds             round budget, at least 1
 * @param scoring               confidence aggregation parameters
 */
public record KindPolicy(
    double disagreementThreshold,
    double minConfidence,
    int maxRounds,
    ScoringPolicy scoring
) {
    public static final double DEFAULT_THRESHOLD      = 20.0;
    public static final double DEFAULT_MIN_CONFIDENCE = 0.6;
    public static final int    DEFAULT_MAX_ROUNDS     = 3;

    public static final KindPolicy DEFAULT = new KindPolicy(
        DEFAULT_THRESHOLD, DEFAULT_MIN_CONFIDENCE, DEFAULT_MAX_ROUNDS, ScoringPolicy.DEFAULT);

    public KindPolicy {
        Objects.requireNonNull(scoring, "scoring");
        if (maxRounds < 1) {
            throw new DebateConfigurationException("max_rounds must be >= 1, was " + maxRounds);
        }
        if (disagreementThreshold < 0.0 || disagreementThreshold > 100.0) {
            throw new DebateConfigurationException(
                "disagreement_threshold must be within [0, 100], was " + disagreementThreshold);
        }
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new DebateConfigurationException("min_confidence must be within [0, 1], was " + minConfidence);
        }
    }

    public KindPolicy withMaxRounds(int rounds) {
        return new KindPolicy(disagreementThreshold, minConfidence, rounds, scoring);
    }
}
