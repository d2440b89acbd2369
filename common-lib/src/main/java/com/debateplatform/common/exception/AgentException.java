package com.debateplatform.common.exception;

import com.debateplatform.common.model.AgentRole;

/**
 * Base class for failures attributable to one agent invocation.
 * The message is prefixed with the role, e.g. {@code [BEAR] provider timed out}.
 */
public class AgentException extends RuntimeException {
    private final AgentRole role;

    public AgentException(AgentRole role, String message) {
        super("[" + role + "] " + message);
        this.role = role;
    }

    public AgentException(AgentRole role, String message, Throwable cause) {
        super("[" + role + "] " + message, cause);
        this.role = role;
    }

    public AgentRole getRole() {
        return role;
    }
}
