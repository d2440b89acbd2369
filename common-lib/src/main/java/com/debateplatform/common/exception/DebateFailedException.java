package com.debateplatform.common.exception;

import com.debateplatform.common.model.DebateState;

/**
 * Terminal failure of a debate run. Carries the {@code FAILED} state so callers can inspect
 * the partial round history.
 */
public class DebateFailedException extends RuntimeException {
    private final transient DebateState state;

    public DebateFailedException(DebateState state, Throwable cause) {
        super("Debate " + state.debateId() + " failed: " + cause.getMessage(), cause);
        this.state = state;
    }

    public DebateState getState() {
        return state;
    }
}
