package com.debateplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Audit artifact of one batch cycle.
 *
 * <p>{@code processed} counts attempted pairs, so
 * {@code processed = succeeded + escalated + failed + cancelled}; a pair whose context could not
 * be loaded counts as failed. Pairs served from cache, already in flight or held by an open
 * escalation are counted in {@code skipped} only.
 */
public record BatchReport(
    @JsonProperty("cycleId")    String      cycleId,
    @JsonProperty("mode")       BatchMode   mode,
    @JsonProperty("status")     Status      status,
    @JsonProperty("startedAt")  Instant     startedAt,
    @JsonProperty("finishedAt") Instant     finishedAt,
    @JsonProperty("processed")  int         processed,
    @JsonProperty("succeeded")  int         succeeded,
    @JsonProperty("escalated")  int         escalated,
    @JsonProperty("failed")     int         failed,
    @JsonProperty("skipped")    int         skipped,
    @JsonProperty("cancelled")  int         cancelled,
    @JsonProperty("error")      String      error
) {
    public enum Status {
        /** Every scheduled debate reached a definitive outcome without failure. */
        COMPLETED,
        /** The cycle finished, but at least one debate failed. */
        COMPLETED_WITH_FAILURES,
        /** Shutdown or abort stopped the cycle. */
        CANCELLED,
        /** Enumeration itself failed; no debates were scheduled. */
        FAILED
    }

    /** A successful cycle advances the incremental watermark. */
    @JsonIgnore
    public boolean isSuccessful() {
        return status == Status.COMPLETED;
    }
}
