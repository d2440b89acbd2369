package com.debateplatform.engine.entity;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/** An entity changed in the entity store; every cached result referencing it is stale. */
public record EntityMutation(
    @JsonProperty("entityId")   String  entityId,
    @JsonProperty("occurredAt") Instant occurredAt
) {}
