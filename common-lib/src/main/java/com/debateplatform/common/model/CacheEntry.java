package com.debateplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A completed debate's result held by the result cache until invalidated or expired.
 */
public record CacheEntry(
    @JsonProperty("key")        CacheKey     key,
    @JsonProperty("result")     DebateResult result,
    @JsonProperty("computedAt") Instant      computedAt,
    @JsonProperty("expiresAt")  Instant      expiresAt
) {
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
