package com.debateplatform.engine.escalation;

public class EscalationNotFoundException extends RuntimeException {

    public EscalationNotFoundException(String id) {
        super("Escalation not found: " + id);
    }
}
