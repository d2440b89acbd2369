package com.debateplatform.common.exception;

import com.debateplatform.common.model.AgentRole;

import java.util.List;

/**
 * Agent payload was not parseable JSON or violated the role's output schema.
 * Never retried and never coerced: the debate fails.
 */
public class SchemaValidationException extends AgentException {
    private final List<String> violations;

    public SchemaValidationException(AgentRole role, String message, List<String> violations) {
        super(role, message + (violations.isEmpty() ? "" : " " + violations));
        this.violations = List.copyOf(violations);
    }

    public SchemaValidationException(AgentRole role, String message, Throwable cause) {
        super(role, message, cause);
        this.violations = List.of();
    }

    public List<String> getViolations() {
        return violations;
    }
}
