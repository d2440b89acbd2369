package com.debateplatform.common.model;

import java.util.Arrays;

/**
 * What a debate decides. Each kind carries its own policy (threshold, minimum confidence,
 * round budget) and its own prompt variants.
 *
 * <p>{@link #code()} is the snake_case form used in persisted rows and configuration keys.
 */
public enum DebateKind {

    /** Score how well an LP fits a fund. */
    LP_MATCH("lp_match"),
    /** Generate pitch content for a fund/LP pair. */
    PITCH_GENERATION("pitch_generation"),
    /** Extract a structured profile from a source document. */
    PROFILE_EXTRACTION("profile_extraction"),
    /** Enrich an entity with derived data. */
    DATA_ENRICHMENT("data_enrichment");

    private final String code;

    DebateKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Resolves either the enum name ({@code LP_MATCH}) or the code ({@code lp_match}).
     *
     * @throws IllegalArgumentException for an unknown kind
     */
    public static DebateKind fromCode(String value) {
        return Arrays.stream(values())
            .filter(k -> k.code.equalsIgnoreCase(value) || k.name().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown debate kind: " + value));
    }
}
