package com.debateplatform.engine.debate;

import com.debateplatform.common.model.CacheEntry;
import com.debateplatform.common.model.EntityPair;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What a poller sees for a pair: a live cached result, or the status of the latest run.
 * Never a stale or fabricated result.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DebateResultView(
    @JsonProperty("status")   Status     status,
    @JsonProperty("pair")     EntityPair pair,
    @JsonProperty("debateId") String     debateId,
    @JsonProperty("entry")    CacheEntry entry,
    @JsonProperty("reason")   String     reason
) {
    public enum Status { COMPLETED, PENDING, ESCALATED, FAILED, NOT_FOUND }

    public static DebateResultView completed(EntityPair pair, CacheEntry entry) {
        return new DebateResultView(Status.COMPLETED, pair, entry.result().debateId(), entry, null);
    }

    public static DebateResultView pending(EntityPair pair, String debateId) {
        return new DebateResultView(Status.PENDING, pair, debateId, null, null);
    }

    public static DebateResultView escalated(EntityPair pair, String debateId, String reason) {
        return new DebateResultView(Status.ESCALATED, pair, debateId, null, reason);
    }

    public static DebateResultView failed(EntityPair pair, String debateId, String reason) {
        return new DebateResultView(Status.FAILED, pair, debateId, null, reason);
    }

    public static DebateResultView notFound(EntityPair pair) {
        return new DebateResultView(Status.NOT_FOUND, pair, null, null, null);
    }
}
