package com.debateplatform.common.scoring;

/**
 * Output of {@link DisagreementScorer}.
 *
 * @param disagreement normalized divergence of the two primary scores [0–100]
 * @param confidence   aggregate confidence of both debaters [0.0–1.0]
 * @param penalized    true when a debater fell below the low-confidence floor
 */
public record DisagreementScore(double disagreement, double confidence, boolean penalized) {}
