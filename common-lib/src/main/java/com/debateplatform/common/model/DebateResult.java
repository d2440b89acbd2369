package com.debateplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Final, explainable outcome of a completed debate. Only ever built from a
 * {@link DebateStatus#COMPLETED} {@link DebateState}; this is what the result cache stores.
 */
public record DebateResult(
    @JsonProperty("debateId")      String       debateId,
    @JsonProperty("pair")          EntityPair   pair,
    @JsonProperty("score")         double       score,
    @JsonProperty("confidence")    double       confidence,
    @JsonProperty("rationale")     String       rationale,
    @JsonProperty("talkingPoints") List<String> talkingPoints,
    @JsonProperty("concerns")      List<String> concerns,
    @JsonProperty("bullCase")      String       bullCase,
    @JsonProperty("bearCase")      String       bearCase,
    @JsonProperty("roundsUsed")    int          roundsUsed,
    @JsonProperty("disagreement")  double       disagreement,
    @JsonProperty("variantId")     String       variantId,
    @JsonProperty("totalTokens")   int          totalTokens,
    @JsonProperty("computedAt")    Instant      computedAt
) {
    public DebateResult {
        talkingPoints = talkingPoints == null ? List.of() : List.copyOf(talkingPoints);
        concerns      = concerns == null ? List.of() : List.copyOf(concerns);
    }

    /**
     * Builds the result from the last recorded round of {@code state}: the synthesis supplies
     * score, confidence and explanation; the debaters supply the bull and bear cases.
     *
     * @throws IllegalStateException when no round was recorded
     */
    public static DebateResult fromFinalRound(DebateState state, Instant computedAt) {
        RoundRecord last = state.latestRound()
            .orElseThrow(() -> new IllegalStateException("no rounds recorded for " + state.debateId()));
        SynthesisOutput synthesis = last.synthesis();
        return new DebateResult(
            state.debateId(),
            state.pair(),
            synthesis.score(),
            synthesis.confidence(),
            synthesis.rationale(),
            synthesis.talkingPoints(),
            synthesis.concerns(),
            last.bull().rationale(),
            last.bear().rationale(),
            last.round(),
            last.disagreement(),
            state.variantId(),
            state.totalTokens(),
            computedAt);
    }
}
