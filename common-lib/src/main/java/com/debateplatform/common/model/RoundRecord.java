package com.debateplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Everything produced in one round: both debater outputs, the synthesis and the
 * disagreement/confidence computed from that round's opposing pair only.
 *
 * <p>Holding exactly one output per role is what keeps "one AgentOutput per (role, round)".
 */
public record RoundRecord(
    @JsonProperty("round")        int             round,
    @JsonProperty("bull")         AgentOutput     bull,
    @JsonProperty("bear")         AgentOutput     bear,
    @JsonProperty("synthesis")    SynthesisOutput synthesis,
    @JsonProperty("disagreement") double          disagreement,
    @JsonProperty("confidence")   double          confidence
) {
    public RoundRecord {
        Objects.requireNonNull(bull, "bull");
        Objects.requireNonNull(bear, "bear");
        Objects.requireNonNull(synthesis, "synthesis");
        if (bull.role() != AgentRole.BULL || bear.role() != AgentRole.BEAR) {
            throw new IllegalArgumentException("round " + round + " expects one BULL and one BEAR output");
        }
        if (bull.round() != round || bear.round() != round || synthesis.round() != round) {
            throw new IllegalArgumentException("all outputs must belong to round " + round);
        }
    }

    public AgentOutput outputOf(AgentRole role) {
        return switch (role) {
            case BULL -> bull;
            case BEAR -> bear;
            case SYNTHESIZER -> throw new IllegalArgumentException("use synthesis() for SYNTHESIZER");
        };
    }

    /** True when either debater raised a disqualifying condition this round. */
    @JsonIgnore
    public boolean hardExclusion() {
        return bull.hardExclusion() || bear.hardExclusion();
    }

    @JsonIgnore
    public int totalTokens() {
        return bull.totalTokens() + bear.totalTokens() + synthesis.totalTokens();
    }
}
