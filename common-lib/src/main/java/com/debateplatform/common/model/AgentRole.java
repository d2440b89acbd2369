package com.debateplatform.common.model;

/**
 * Agent roles taking part in a debate. {@link #BULL} and {@link #BEAR} argue opposite sides;
 * {@link #SYNTHESIZER} combines their current outputs into one position.
 */
public enum AgentRole {

    BULL,
    BEAR,
    SYNTHESIZER;

    /**
     * The opposing debater, whose prior-round output is this role's cross-feedback.
     *
     * @throws IllegalStateException for {@link #SYNTHESIZER}, which has no opponent
     */
    public AgentRole opponent() {
        return switch (this) {
            case BULL -> BEAR;
            case BEAR -> BULL;
            case SYNTHESIZER -> throw new IllegalStateException("SYNTHESIZER has no opponent");
        };
    }

    /** Lower-case name used in template paths and persisted rows. */
    public String code() {
        return name().toLowerCase();
    }
}
