package com.debateplatform.engine.entity;

import com.debateplatform.common.model.DebateContext;
import com.debateplatform.common.model.DebateKind;
import com.debateplatform.common.model.EntityPair;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/** Read access to the relational entity store that owns funds, LPs and their relations. */
public interface EntityStore {

    /** Every pair eligible for a debate of {@code kind}. */
    Flux<EntityPair> eligiblePairs(DebateKind kind);

    /** Pairs of {@code kind} with at least one side changed after {@code since}. */
    Flux<EntityPair> changedPairs(DebateKind kind, Instant since);

    /** Current profiles of both sides of the pair, stamped with the instant the read began. */
    Mono<DebateContext> loadContext(EntityPair pair);

    /** Live mutation events; completes or errors when the connection drops. */
    Flux<EntityMutation> mutations();
}
