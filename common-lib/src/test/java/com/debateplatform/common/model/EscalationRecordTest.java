package com.debateplatform.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EscalationRecordTest {

    private static final Instant T0 = Instant.parse("2026-01-05T09:00:00Z");

    private static EscalationRecord pending() {
        DebateState state = DebateState.start("d-7", EntityPair.of("f", "l", DebateKind.LP_MATCH), "v", 1, "fp", T0);
        state.beginRound(T0);
        state.fail("unused", T0);
        return new EscalationRecord("e-1", state.debateId(), state.pair(), EscalationReason.LOW_CONFIDENCE,
            "confidence = 0.30", state.rounds(), EscalationStatus.PENDING, null, null, null, T0, null);
    }

    @Test
    @DisplayName("assign keeps the escalation open")
    void assign() {
        EscalationRecord assigned = pending().assign("analyst@firm");
        assertThat(assigned.status()).isEqualTo(EscalationStatus.ASSIGNED);
        assertThat(assigned.assignedTo()).isEqualTo("analyst@firm");
        assertThat(assigned.isOpen()).isTrue();
    }

    @Test
    @DisplayName("decide records resolution, reviewer and time")
    void decide() {
        EscalationRecord resolved = pending().decide(
            new EscalationDecision(EscalationStatus.RESOLVED, "approved manually", "partner"), T0.plusSeconds(60));
        assertThat(resolved.isOpen()).isFalse();
        assertThat(resolved.resolvedBy()).isEqualTo("partner");
        assertThat(resolved.resolvedAt()).isEqualTo(T0.plusSeconds(60));
    }

    @Test
    @DisplayName("a resolved escalation cannot be decided again")
    void terminalIsFinal() {
        EscalationRecord dismissed = pending().decide(
            new EscalationDecision(EscalationStatus.DISMISSED, null, "partner"), T0);
        assertThatThrownBy(() -> dismissed.decide(
            new EscalationDecision(EscalationStatus.RESOLVED, "x", "partner"), T0))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> dismissed.assign("someone")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("a decision must be terminal")
    void decisionMustBeTerminal() {
        assertThatThrownBy(() -> new EscalationDecision(EscalationStatus.IN_REVIEW, "x", "partner"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
