package com.debateplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A reviewer's verdict on an escalation. {@code outcome} must be terminal
 * ({@link EscalationStatus#RESOLVED} or {@link EscalationStatus#DISMISSED}).
 */
public record EscalationDecision(
    @JsonProperty("outcome")    EscalationStatus outcome,
    @JsonProperty("resolution") String           resolution,
    @JsonProperty("decidedBy")  String           decidedBy
) {
    public EscalationDecision {
        if (outcome == null || outcome.isOpen()) {
            throw new IllegalArgumentException("decision outcome must be RESOLVED or DISMISSED, was " + outcome);
        }
        if (decidedBy == null || decidedBy.isBlank()) {
            throw new IllegalArgumentException("decidedBy must not be blank");
        }
    }
}
