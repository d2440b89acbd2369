package com.debateplatform.common.policy;

import com.debateplatform.common.model.EscalationReason;

/** What happens after a round has been synthesized and scored. */
public enum RoundDecision {

    /** A debater raised a disqualifying condition; overrides everything else. */
    ESCALATE_HARD_EXCLUSION(EscalationReason.HARD_EXCLUSION),
    /** Disagreement within threshold and confidence above the bar. */
    COMPLETE(null),
    /** No consensus yet and rounds remain: run the next round with cross-feedback. */
    REGENERATE(null),
    /** Rounds exhausted with disagreement above threshold. */
    ESCALATE_MAX_ROUNDS(EscalationReason.MAJOR_DISAGREEMENT),
    /** Rounds exhausted with debaters in agreement but confidence below the bar. */
    ESCALATE_LOW_CONFIDENCE(EscalationReason.LOW_CONFIDENCE);

    private final EscalationReason escalationReason;

    RoundDecision(EscalationReason escalationReason) {
        this.escalationReason = escalationReason;
    }

    public boolean isEscalation() {
        return escalationReason != null;
    }

    /** Reason recorded on the escalation; {@code null} for non-escalating decisions. */
    public EscalationReason escalationReason() {
        return escalationReason;
    }
}
