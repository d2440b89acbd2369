package com.debateplatform.common.model;

/**
 * Why a debate was handed to a human. The debate engine itself raises
 * {@link #HARD_EXCLUSION}, {@link #MAJOR_DISAGREEMENT} and {@link #LOW_CONFIDENCE};
 * the others are raised by reviewers or upstream tooling.
 */
public enum EscalationReason {

    /** A debater flagged a disqualifying condition. */
    HARD_EXCLUSION,
    /** Rounds exhausted with disagreement still above the threshold. */
    MAJOR_DISAGREEMENT,
    /** Debaters agreed but aggregate confidence stayed below the bar. */
    LOW_CONFIDENCE,
    MISSING_DATA,
    POLICY_VIOLATION,
    USER_REQUESTED,
    ANOMALY_DETECTED
}
