package com.debateplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * The subject of a debate: two opaque entity identifiers and the debate kind.
 *
 * <p>For {@link DebateKind#LP_MATCH} the primary id is the fund and the secondary id the LP
 * organisation. Order matters: {@code (a, b)} and {@code (b, a)} are different pairs.
 */
public record EntityPair(
    @JsonProperty("primaryId")   String primaryId,
    @JsonProperty("secondaryId") String secondaryId,
    @JsonProperty("kind")        DebateKind kind
) {
    public EntityPair {
        if (primaryId == null || primaryId.isBlank()) {
            throw new IllegalArgumentException("primaryId must not be blank");
        }
        if (secondaryId == null || secondaryId.isBlank()) {
            throw new IllegalArgumentException("secondaryId must not be blank");
        }
        Objects.requireNonNull(kind, "kind");
    }

    public static EntityPair of(String primaryId, String secondaryId, DebateKind kind) {
        return new EntityPair(primaryId, secondaryId, kind);
    }

    /** Kind-independent identity of the two entities, used for variant bucketing. */
    @JsonIgnore
    public String pairId() {
        return primaryId + ":" + secondaryId;
    }

    /** Unique in-flight / lookup key: kind plus both ids. */
    @JsonIgnore
    public String key() {
        return kind.code() + "|" + primaryId + "|" + secondaryId;
    }

    public boolean references(String entityId) {
        return primaryId.equals(entityId) || secondaryId.equals(entityId);
    }
}
