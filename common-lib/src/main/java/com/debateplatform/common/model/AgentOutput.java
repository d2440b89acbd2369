package com.debateplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One debater's result for one round.
 *
 * <p>Immutable: the next round receives this record as cross-feedback and must never be able
 * to alter what was recorded. List fields are copied on construction.
 *
 * <p>{@code score} is on the 0–100 scale, {@code confidence} on 0.0–1.0.
 * {@code hardExclusion} is the agent's disqualifying-condition signal; it is a domain signal,
 * not an error, and forces escalation regardless of disagreement.
 */
public record AgentOutput(
    @JsonProperty("role")            AgentRole    role,
    @JsonProperty("round")           int          round,
    @JsonProperty("score")           double       score,
    @JsonProperty("confidence")      double       confidence,
    @JsonProperty("rationale")       String       rationale,
    @JsonProperty("evidence")        List<String> evidence,
    @JsonProperty("concerns")        List<String> concerns,
    @JsonProperty("hardExclusion")   boolean      hardExclusion,
    @JsonProperty("exclusionReason") String       exclusionReason,
    @JsonProperty("inputTokens")     int          inputTokens,
    @JsonProperty("outputTokens")    int          outputTokens
) {
    public AgentOutput {
        Objects.requireNonNull(role, "role");
        if (role == AgentRole.SYNTHESIZER) {
            throw new IllegalArgumentException("AgentOutput is for debaters; use SynthesisOutput");
        }
        if (round < 1) {
            throw new IllegalArgumentException("round must be >= 1, was " + round);
        }
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        concerns = concerns == null ? List.of() : List.copyOf(concerns);
    }

    public int totalTokens() {
        return inputTokens + outputTokens;
    }
}
