package com.debateplatform.common.model;

import com.debateplatform.common.exception.DebateConfigurationException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable run record of one debate.
 *
 * <p>Owned by exactly one running debate at a time, so it is not synchronized. Every mutator
 * validates the {@link DebateStatus} transition and throws {@link IllegalStateException} on an
 * illegal one; the round index can never pass {@link #maxRounds()}.
 *
 * <p>Recorded rounds are immutable {@link RoundRecord}s; only the bookkeeping fields
 * (status, current disagreement/confidence, result) change over the run.
 */
public final class DebateState {

    private final String     debateId;
    private final EntityPair pair;
    private final String     variantId;
    private final int        maxRounds;
    private final String     contextFingerprint;
    private final Instant    startedAt;

    private final List<RoundRecord> rounds = new ArrayList<>();

    private DebateStatus     status = DebateStatus.PENDING;
    private int              roundIndex;
    private Double           disagreement;
    private Double           confidence;
    private DebateResult     result;
    private EscalationReason escalationReason;
    private String           statusReason;
    private Instant          updatedAt;
    private Instant          finishedAt;

    private DebateState(String debateId, EntityPair pair, String variantId, int maxRounds,
                        String contextFingerprint, Instant startedAt) {
        this.debateId           = Objects.requireNonNull(debateId, "debateId");
        this.pair               = Objects.requireNonNull(pair, "pair");
        this.variantId          = variantId;
        this.maxRounds          = maxRounds;
        this.contextFingerprint = contextFingerprint;
        this.startedAt          = startedAt;
        this.updatedAt          = startedAt;
    }

    /**
     * Creates a {@link DebateStatus#PENDING} state.
     *
     * @throws DebateConfigurationException when {@code maxRounds < 1}
     */
    public static DebateState start(String debateId, EntityPair pair, String variantId, int maxRounds,
                                    String contextFingerprint, Instant now) {
        if (maxRounds < 1) {
            throw new DebateConfigurationException("max_rounds must be >= 1 for kind "
                + pair.kind().code() + ", was " + maxRounds);
        }
        return new DebateState(debateId, pair, variantId, maxRounds, contextFingerprint, now);
    }

    // ── transitions ───────────────────────────────────────────────────────────

    /**
     * Opens the next round. Valid from PENDING (round 1) and from SYNTHESIZING (regenerate).
     *
     * @return the new 1-based round index
     */
    public int beginRound(Instant now) {
        if (roundIndex >= maxRounds) {
            throw new IllegalStateException("debate " + debateId + " already used all "
                + maxRounds + " rounds");
        }
        transitionTo(DebateStatus.DEBATING, now);
        roundIndex++;
        return roundIndex;
    }

    public void beginSynthesis(Instant now) {
        transitionTo(DebateStatus.SYNTHESIZING, now);
    }

    /**
     * Records the current round's outputs and replaces the current disagreement/confidence
     * with the values of this round alone.
     */
    public void recordRound(RoundRecord record, Instant now) {
        if (status != DebateStatus.SYNTHESIZING) {
            throw new IllegalStateException("round can only be recorded while SYNTHESIZING, was " + status);
        }
        if (record.round() != roundIndex) {
            throw new IllegalStateException("expected round " + roundIndex + " but got " + record.round());
        }
        if (rounds.stream().anyMatch(r -> r.round() == record.round())) {
            throw new IllegalStateException("round " + record.round() + " already recorded");
        }
        rounds.add(record);
        disagreement = record.disagreement();
        confidence   = record.confidence();
        updatedAt    = now;
    }

    public void complete(DebateResult finalResult, Instant now) {
        transitionTo(DebateStatus.COMPLETED, now);
        this.result     = Objects.requireNonNull(finalResult, "finalResult");
        this.finishedAt = now;
    }

    public void escalate(EscalationReason reason, String description, Instant now) {
        transitionTo(DebateStatus.ESCALATED, now);
        this.escalationReason = Objects.requireNonNull(reason, "reason");
        this.statusReason     = description;
        this.finishedAt       = now;
    }

    /** Marks the run failed; recorded rounds are kept for inspection. */
    public void fail(String reason, Instant now) {
        transitionTo(DebateStatus.FAILED, now);
        this.statusReason = reason;
        this.finishedAt   = now;
    }

    private void transitionTo(DebateStatus next, Instant now) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("illegal transition " + status + " → " + next
                + " for debate " + debateId);
        }
        status    = next;
        updatedAt = now;
    }

    // ── queries ───────────────────────────────────────────────────────────────

    public Optional<RoundRecord> latestRound() {
        return rounds.isEmpty() ? Optional.empty() : Optional.of(rounds.get(rounds.size() - 1));
    }

    /**
     * The opposing debater's output from the latest recorded round; empty before round 2.
     */
    public Optional<AgentOutput> crossFeedbackFor(AgentRole role) {
        return latestRound().map(r -> r.outputOf(role.opponent()));
    }

    public List<Double> disagreementTrajectory() {
        return rounds.stream().map(RoundRecord::disagreement).toList();
    }

    public int totalTokens() {
        return rounds.stream().mapToInt(RoundRecord::totalTokens).sum();
    }

    public boolean hasRoundsLeft() {
        return roundIndex < maxRounds;
    }

    public String debateId()            { return debateId; }
    public EntityPair pair()            { return pair; }
    public String variantId()           { return variantId; }
    public int maxRounds()              { return maxRounds; }
    public String contextFingerprint()  { return contextFingerprint; }
    public Instant startedAt()          { return startedAt; }
    public List<RoundRecord> rounds()   { return Collections.unmodifiableList(rounds); }
    public DebateStatus status()        { return status; }
    public int roundIndex()             { return roundIndex; }
    public Double disagreement()        { return disagreement; }
    public Double confidence()          { return confidence; }
    public Optional<DebateResult> result() { return Optional.ofNullable(result); }
    public EscalationReason escalationReason() { return escalationReason; }
    public String statusReason()        { return statusReason; }
    public Instant updatedAt()          { return updatedAt; }
    public Instant finishedAt()         { return finishedAt; }

    @Override
    public String toString() {
        return "DebateState{debateId=" + debateId + ", pair=" + pair.key() + ", status=" + status
            + ", round=" + roundIndex + "/" + maxRounds + ", disagreement=" + disagreement + "}";
    }
}
