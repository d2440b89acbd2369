package com.debateplatform.common.model;

/**
 * Non-error result of running a debate. Failures are error signals
 * ({@link com.debateplatform.common.exception.DebateFailedException}), not outcomes.
 */
public sealed interface DebateOutcome
    permits DebateOutcome.Completed, DebateOutcome.Escalated, DebateOutcome.Cancelled {

    DebateState state();

    /** Consensus reached within bounds. */
    record Completed(DebateState state, DebateResult result) implements DebateOutcome {}

    /** Handed to a human reviewer. */
    record Escalated(DebateState state, EscalationRecord escalation) implements DebateOutcome {}

    /** Stopped between rounds; the state stays at its last persisted point. */
    record Cancelled(DebateState state) implements DebateOutcome {}
}
