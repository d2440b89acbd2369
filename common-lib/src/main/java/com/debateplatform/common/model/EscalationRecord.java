package com.debateplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * A debate handed over for human adjudication, with its full round history.
 *
 * <p>Immutable; lifecycle changes ({@link #assign}, {@link #decide}) return a new record.
 * {@link EscalationStatus#RESOLVED} and {@link EscalationStatus#DISMISSED} are terminal.
 */
public record EscalationRecord(
    @JsonProperty("id")          String            id,
    @JsonProperty("debateId")    String            debateId,
    @JsonProperty("pair")        EntityPair        pair,
    @JsonProperty("reason")      EscalationReason  reason,
    @JsonProperty("description") String            description,
    @JsonProperty("rounds")      List<RoundRecord> rounds,
    @JsonProperty("status")      EscalationStatus  status,
    @JsonProperty("assignedTo")  String            assignedTo,
    @JsonProperty("resolution")  String            resolution,
    @JsonProperty("resolvedBy")  String            resolvedBy,
    @JsonProperty("createdAt")   Instant           createdAt,
    @JsonProperty("resolvedAt")  Instant           resolvedAt
) {
    public EscalationRecord {
        rounds = rounds == null ? List.of() : List.copyOf(rounds);
    }

    public static EscalationRecord open(String id, DebateState state, Instant now) {
        return new EscalationRecord(id, state.debateId(), state.pair(), state.escalationReason(),
            state.statusReason(), state.rounds(), EscalationStatus.PENDING,
            null, null, null, now, null);
    }

    public boolean isOpen() {
        return status.isOpen();
    }

    public EscalationRecord assign(String reviewer) {
        requireOpen();
        return new EscalationRecord(id, debateId, pair, reason, description, rounds,
            EscalationStatus.ASSIGNED, reviewer, resolution, resolvedBy, createdAt, resolvedAt);
    }

    /**
     * Applies a reviewer's terminal decision.
     *
     * @throws IllegalStateException when this escalation is already resolved or dismissed
     */
    public EscalationRecord decide(EscalationDecision decision, Instant now) {
        requireOpen();
        return new EscalationRecord(id, debateId, pair, reason, description, rounds,
            decision.outcome(), assignedTo, decision.resolution(), decision.decidedBy(), createdAt, now);
    }

    private void requireOpen() {
        if (!isOpen()) {
            throw new IllegalStateException("escalation " + id + " is already " + status);
        }
    }
}
