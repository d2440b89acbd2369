package com.debateplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Input snapshot a debate reasons over: the two entity profiles as loaded from the entity store.
 *
 * <p>{@link #fingerprint()} hashes the pair, the kind and both profiles with map keys sorted at
 * every depth, so any change to the relevant input state yields a different cache key while
 * key order in the source payload does not. Leaf values carry their type, so {@code "1"} and
 * {@code 1} differ.
 *
 * <p>{@code loadedAt} is the instant the snapshot was taken (read start). A mutation of either
 * entity at or after it makes any result computed from this snapshot stale. It is not part of
 * the fingerprint.
 */
public record DebateContext(
    @JsonProperty("pair")      EntityPair          pair,
    @JsonProperty("primary")   Map<String, Object> primary,
    @JsonProperty("secondary") Map<String, Object> secondary,
    @JsonProperty("loadedAt")  Instant             loadedAt
) {
    public DebateContext {
        Objects.requireNonNull(pair, "pair");
        Objects.requireNonNull(loadedAt, "loadedAt");
        // profile values may be null, so Map.copyOf is not an option
        primary   = primary == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(primary));
        secondary = secondary == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(secondary));
    }

    public String fingerprint() {
        String canonical = pair.key() + "\n" + canonical(primary) + "\n" + canonical(secondary);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String canonical(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, String> sorted = new TreeMap<>();
            map.forEach((k, v) -> sorted.put(String.valueOf(k), canonical(v)));
            return sorted.toString();
        }
        if (value instanceof List<?> list) {
            return list.stream().map(DebateContext::canonical).collect(Collectors.joining(",", "[", "]"));
        }
        if (value == null) {
            return "null";
        }
        return value.getClass().getSimpleName() + ":" + value;
    }
}
