package com.debateplatform.common.scoring;

import com.debateplatform.common.model.AgentOutput;

/**
 * Measures how far apart the two debaters of a round are.
 *
 * <h3>Disagreement</h3>
 * <p>{@code |score_a − score_b|} with both scores clamped to [0, 100], so the result is already
 * on the normalized 0–100 scale.
 *
 * <h3>Confidence</h3>
 * <ol>
 *   <li>Clamp both self-reported confidences to [0.0, 1.0].</li>
 *   <li>Combine them with the policy's {@link ConfidenceAggregation}.</li>
 *   <li>If either is below {@link ScoringPolicy#lowConfidenceFloor()}, multiply by
 *       {@link ScoringPolicy#lowConfidencePenalty()}.</li>
 * </ol>
 *
 * <p>Every step is symmetric, hence {@code score(a, b, p).equals(score(b, a, p))}.
 * Stateless, pure and thread-safe.
 */
public final class DisagreementScorer {

    public static final double MAX_SCORE = 100.0;

    private DisagreementScorer() {}

    public static DisagreementScore score(AgentOutput a, AgentOutput b, ScoringPolicy policy) {
        return score(a.score(), a.confidence(), b.score(), b.confidence(), policy);
    }

    public static DisagreementScore score(double scoreA, double confidenceA,
                                          double scoreB, double confidenceB,
                                          ScoringPolicy policy) {
        double disagreement = Math.abs(clamp(scoreA, 0.0, MAX_SCORE) - clamp(scoreB, 0.0, MAX_SCORE));

        double ca = clamp(confidenceA, 0.0, 1.0);
        double cb = clamp(confidenceB, 0.0, 1.0);
        double aggregate = policy.aggregation().apply(ca, cb);

        boolean penalized = ca < policy.lowConfidenceFloor() || cb < policy.lowConfidenceFloor();
        if (penalized) {
            aggregate *= policy.lowConfidencePenalty();
        }
        return new DisagreementScore(disagreement, aggregate, penalized);
    }

    private static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }
}
