package com.debateplatform.common.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a {@link DebateState}.
 *
 * <pre>
 *   PENDING → DEBATING → SYNTHESIZING → COMPLETED
 *                 ↑            │      → ESCALATED
 *                 └────────────┘ (regenerate with cross-feedback)
 *   any non-terminal state → FAILED
 * </pre>
 */
public enum DebateStatus {

    PENDING,
    DEBATING,
    SYNTHESIZING,
    COMPLETED,
    ESCALATED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ESCALATED || this == FAILED;
    }

    public boolean canTransitionTo(DebateStatus next) {
        return allowedNext().contains(next);
    }

    private Set<DebateStatus> allowedNext() {
        return switch (this) {
            case PENDING      -> EnumSet.of(DEBATING, FAILED);
            case DEBATING     -> EnumSet.of(SYNTHESIZING, FAILED);
            case SYNTHESIZING -> EnumSet.of(COMPLETED, DEBATING, ESCALATED, FAILED);
            case COMPLETED, ESCALATED, FAILED -> EnumSet.noneOf(DebateStatus.class);
        };
    }
}
