package com.debateplatform.engine.debate;

import com.debateplatform.common.model.CacheEntry;
import com.debateplatform.common.model.DebateStatus;
import com.debateplatform.common.model.EntityPair;
import com.debateplatform.engine.cache.DebateResultCache;
import com.debateplatform.engine.store.DebateRunEntity;
import com.debateplatform.engine.store.DebateRunStore;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * {@code get_result}: resolves what a poller sees for a pair, in this order:
 * <ol>
 *   <li>a live cache entry → COMPLETED</li>
 *   <li>a run in flight → PENDING</li>
 *   <li>the latest persisted run: ESCALATED and FAILED as recorded, a non-terminal run
 *       (cancelled mid-way) as PENDING</li>
 *   <li>otherwise NOT_FOUND, including completed runs whose cache entry was invalidated or
 *       expired, since their inputs may have changed since</li>
 * </ol>
 */
@Service
public class DebateQueryService {

    private final DebateResultCache resultCache;
    private final InFlightRegistry inFlight;
    private final DebateRunStore runStore;

    public DebateQueryService(DebateResultCache resultCache, InFlightRegistry inFlight, DebateRunStore runStore) {
        this.resultCache = resultCache;
        this.inFlight    = inFlight;
        this.runStore    = runStore;
    }

    public Mono<DebateResultView> getResult(EntityPair pair) {
        return Mono.defer(() -> {
            Optional<CacheEntry> cached = resultCache.findLatest(pair);
            if (cached.isPresent()) {
                return Mono.just(DebateResultView.completed(pair, cached.get()));
            }
            Optional<InFlightRegistry.Ticket> running = inFlight.current(pair);
            if (running.isPresent()) {
                return Mono.just(DebateResultView.pending(pair, running.get().debateId()));
            }
            return runStore.findLatest(pair)
                .map(run -> fromRun(pair, run))
                .defaultIfEmpty(DebateResultView.notFound(pair));
        });
    }

    private static DebateResultView fromRun(EntityPair pair, DebateRunEntity run) {
        DebateStatus status = DebateStatus.valueOf(run.getStatus());
        return switch (status) {
            case ESCALATED -> DebateResultView.escalated(pair, run.getDebateId(),
                run.getEscalationReason() + ": " + run.getStatusReason());
            case FAILED -> DebateResultView.failed(pair, run.getDebateId(), run.getStatusReason());
            case PENDING, DEBATING, SYNTHESIZING -> DebateResultView.pending(pair, run.getDebateId());
            case COMPLETED -> DebateResultView.notFound(pair);
        };
    }
}
