package com.debateplatform.common.exception;

import com.debateplatform.common.model.AgentRole;

/**
 * Failure of the completion provider.
 *
 * <p>{@link Kind#TRANSIENT} failures (timeouts, connection errors, HTTP 429 and 5xx) are
 * retried by the agent invoker; {@link Kind#PERMANENT} failures fail the debate at once.
 */
public class ProviderException extends AgentException {

    public enum Kind { TRANSIENT, PERMANENT }

    private final Kind kind;

    public ProviderException(AgentRole role, Kind kind, String message) {
        super(role, message);
        this.kind = kind;
    }

    public ProviderException(AgentRole role, Kind kind, String message, Throwable cause) {
        super(role, message, cause);
        this.kind = kind;
    }

    public static ProviderException transientFailure(AgentRole role, String message, Throwable cause) {
        return new ProviderException(role, Kind.TRANSIENT, message, cause);
    }

    public static ProviderException permanentFailure(AgentRole role, String message, Throwable cause) {
        return new ProviderException(role, Kind.PERMANENT, message, cause);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isTransient() {
        return kind == Kind.TRANSIENT;
    }

    /** Predicate form for {@code Retry.filter(...)}. */
    public static boolean isTransient(Throwable t) {
        return t instanceof ProviderException pe && pe.isTransient();
    }
}
