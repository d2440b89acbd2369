package com.debateplatform.common.model;

import java.util.EnumSet;
import java.util.Set;

/** Review lifecycle of an {@link EscalationRecord}. */
public enum EscalationStatus {

    PENDING,
    ASSIGNED,
    IN_REVIEW,
    RESOLVED,
    DISMISSED;

    public static final Set<EscalationStatus> OPEN = EnumSet.of(PENDING, ASSIGNED, IN_REVIEW);

    public boolean isOpen() {
        return OPEN.contains(this);
    }
}
