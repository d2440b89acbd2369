package com.debateplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The synthesizer's combined position for one round: score (0–100), confidence (0.0–1.0),
 * rationale, talking points for the outreach and concerns the counterparty may raise.
 */
public record SynthesisOutput(
    @JsonProperty("round")         int          round,
    @JsonProperty("score")         double       score,
    @JsonProperty("confidence")    double       confidence,
    @JsonProperty("rationale")     String       rationale,
    @JsonProperty("talkingPoints") List<String> talkingPoints,
    @JsonProperty("concerns")      List<String> concerns,
    @JsonProperty("inputTokens")   int          inputTokens,
    @JsonProperty("outputTokens")  int          outputTokens
) {
    public SynthesisOutput {
        talkingPoints = talkingPoints == null ? List.of() : List.copyOf(talkingPoints);
        concerns      = concerns == null ? List.of() : List.copyOf(concerns);
    }

    public int totalTokens() {
        return inputTokens + outputTokens;
    }
}
