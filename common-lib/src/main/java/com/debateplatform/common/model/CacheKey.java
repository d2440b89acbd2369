package com.debateplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Result cache key: the pair (which carries the kind) plus the fingerprint of the input state
 * the result was computed from.
 */
public record CacheKey(
    @JsonProperty("pair")        EntityPair pair,
    @JsonProperty("fingerprint") String     fingerprint
) {
    public CacheKey {
        Objects.requireNonNull(pair, "pair");
        Objects.requireNonNull(fingerprint, "fingerprint");
    }

    public static CacheKey of(DebateContext context) {
        return new CacheKey(context.pair(), context.fingerprint());
    }
}
