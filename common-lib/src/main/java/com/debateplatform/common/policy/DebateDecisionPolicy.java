package com.debateplatform.common.policy;

import com.debateplatform.common.model.AgentOutput;
import com.debateplatform.common.model.RoundRecord;

import java.util.Locale;
import java.util.stream.Stream;

/**
 * The debate's transition function, evaluated once per round after synthesis.
 *
 * <h3>Priority order</h3>
 * <ol>
 *   <li>Any debater signals a hard exclusion → {@link RoundDecision#ESCALATE_HARD_EXCLUSION}.</li>
 *   <li>{@code disagreement ≤ threshold} and {@code confidence ≥ minConfidence}
 *       → {@link RoundDecision#COMPLETE}.</li>
 *   <li>{@code roundIndex < maxRounds} → {@link RoundDecision#REGENERATE}.</li>
 *   <li>Otherwise escalate: {@link RoundDecision#ESCALATE_MAX_ROUNDS} when disagreement is
 *       above threshold, else {@link RoundDecision#ESCALATE_LOW_CONFIDENCE}.</li>
 * </ol>
 *
 * <p>Low confidence never completes, even at zero disagreement: two agents agreeing while
 * neither is sure is a false consensus.
 *
 * <p>Stateless, pure and thread-safe.
 */
public final class DebateDecisionPolicy {

    private DebateDecisionPolicy() {}

    public static RoundDecision decide(RoundRecord round, int roundIndex, KindPolicy policy) {
        if (round.hardExclusion()) {
            return RoundDecision.ESCALATE_HARD_EXCLUSION;
        }
        boolean withinThreshold = round.disagreement() <= policy.disagreementThreshold();
        if (withinThreshold && round.confidence() >= policy.minConfidence()) {
            return RoundDecision.COMPLETE;
        }
        if (roundIndex < policy.maxRounds()) {
            return RoundDecision.REGENERATE;
        }
        return withinThreshold ? RoundDecision.ESCALATE_LOW_CONFIDENCE : RoundDecision.ESCALATE_MAX_ROUNDS;
    }

    /**
     * Human-readable escalation description citing the round and the numbers that caused it.
     */
    public static String describe(RoundDecision decision, RoundRecord round, KindPolicy policy) {
        return switch (decision) {
            case ESCALATE_HARD_EXCLUSION -> "hard exclusion raised in round " + round.round() + ": "
                + exclusionReasons(round);
            case ESCALATE_MAX_ROUNDS -> String.format(Locale.ROOT,
                "max rounds exceeded at round %d, disagreement = %.1f (threshold %.1f)",
                round.round(), round.disagreement(), policy.disagreementThreshold());
            case ESCALATE_LOW_CONFIDENCE -> String.format(Locale.ROOT,
                "max rounds exceeded at round %d, confidence = %.2f below %.2f (disagreement = %.1f)",
                round.round(), round.confidence(), policy.minConfidence(), round.disagreement());
            case COMPLETE, REGENERATE -> throw new IllegalArgumentException(decision + " is not an escalation");
        };
    }

    private static String exclusionReasons(RoundRecord round) {
        return String.join("; ", Stream.of(round.bull(), round.bear())
            .filter(AgentOutput::hardExclusion)
            .map(o -> o.role() + " - " + (o.exclusionReason() == null ? "unspecified" : o.exclusionReason()))
            .toList());
    }
}
