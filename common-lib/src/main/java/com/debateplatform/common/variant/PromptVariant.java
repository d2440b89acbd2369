package com.debateplatform.common.variant;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A prompt/model combination a debate can run with.
 *
 * @param id          stable identifier recorded on every run, e.g. {@code lp-match-v2.1}
 * @param templateSet directory under {@code prompts/} holding the role templates
 * @param model       completion model identifier
 * @param weight      relative share of pairs routed to this variant, at least 1
 */
public record PromptVariant(
    @JsonProperty("id")          String id,
    @JsonProperty("templateSet") String templateSet,
    @JsonProperty("model")       String model,
    @JsonProperty("weight")      int    weight
) {
    public PromptVariant {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("variant id must not be blank");
        }
        if (templateSet == null || templateSet.isBlank()) {
            throw new IllegalArgumentException("variant " + id + " needs a templateSet");
        }
        if (weight < 1) {
            throw new IllegalArgumentException("variant " + id + " weight must be >= 1, was " + weight);
        }
    }
}
