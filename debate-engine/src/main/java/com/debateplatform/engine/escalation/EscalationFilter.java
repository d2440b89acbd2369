package com.debateplatform.engine.escalation;

import com.debateplatform.common.model.DebateKind;
import com.debateplatform.common.model.EscalationStatus;

/**
 * Optional criteria of {@code list_escalations}; a {@code null} field matches everything.
 */
public record EscalationFilter(EscalationStatus status, DebateKind kind, String entityId, int limit) {

    public static final int DEFAULT_LIMIT = 100;

    public EscalationFilter {
        if (limit < 1) {
            limit = DEFAULT_LIMIT;
        }
    }

    public static EscalationFilter all() {
        return new EscalationFilter(null, null, null, DEFAULT_LIMIT);
    }
}
