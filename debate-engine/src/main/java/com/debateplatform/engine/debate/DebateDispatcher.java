package com.debateplatform.engine.debate;

import com.debateplatform.common.model.DebateContext;
import com.debateplatform.common.model.DebateOutcome;
import com.debateplatform.common.model.EntityPair;
import com.debateplatform.engine.entity.EntityStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for running debates under the in-flight lock.
 *
 * <p>{@link #requestDebate(EntityPair)} enqueues a run and returns its id at once; while a run
 * for the pair is in flight the existing id is returned instead. {@link #runExclusive} is the
 * batch path: it runs to the outcome, or completes empty when the pair is already running.
 *
 * <p>On shutdown every running debate is signalled and stops before its next round.
 */
@Service
public class DebateDispatcher {

    private static final Logger log = LoggerFactory.getLogger(DebateDispatcher.class);

    private final DebateOrchestrator orchestrator;
    private final EntityStore entityStore;
    private final InFlightRegistry inFlight;

    public DebateDispatcher(DebateOrchestrator orchestrator, EntityStore entityStore, InFlightRegistry inFlight) {
        this.orchestrator = orchestrator;
        this.entityStore  = entityStore;
        this.inFlight     = inFlight;
    }

    /** {@code request_debate}: async enqueue, returns the debate id. */
    public Mono<String> requestDebate(EntityPair pair) {
        return Mono.fromCallable(() -> {
            while (true) {
                String candidate = UUID.randomUUID().toString();
                Optional<InFlightRegistry.Ticket> acquired = inFlight.tryAcquire(pair, candidate);
                if (acquired.isPresent()) {
                    launch(acquired.get());
                    return candidate;
                }
                Optional<InFlightRegistry.Ticket> running = inFlight.current(pair);
                if (running.isPresent()) {
                    log.info("Debate already in flight. pair={} debateId={}", pair.key(), running.get().debateId());
                    return running.get().debateId();
                }
                // released between the two lookups; try again
            }
        });
    }

    /**
     * Runs a debate for an already loaded context, holding the in-flight lock for its duration.
     *
     * @return the outcome, or empty when the pair is already in flight
     */
    public Mono<DebateOutcome> runExclusive(DebateContext context) {
        return Mono.defer(() -> {
            Optional<InFlightRegistry.Ticket> acquired =
                inFlight.tryAcquire(context.pair(), UUID.randomUUID().toString());
            if (acquired.isEmpty()) {
                return Mono.empty();
            }
            InFlightRegistry.Ticket ticket = acquired.get();
            return orchestrator.run(context, ticket.debateId(), ticket.token())
                .doFinally(signal -> inFlight.release(ticket));
        });
    }

    private void launch(InFlightRegistry.Ticket ticket) {
        log.info("Debate requested. pair={} debateId={}", ticket.pair().key(), ticket.debateId());
        entityStore.loadContext(ticket.pair())
            .flatMap(context -> orchestrator.run(context, ticket.debateId(), ticket.token()))
            .doFinally(signal -> inFlight.release(ticket))
            .subscribe(
                outcome -> log.info("Requested debate finished. debateId={} outcome={}",
                                    ticket.debateId(), outcome.getClass().getSimpleName()),
                err -> log.error("Requested debate failed. debateId={} pair={} reason={}",
                                 ticket.debateId(), ticket.pair().key(), err.getMessage()));
    }

    @PreDestroy
    public void shutdown() {
        int signalled = inFlight.cancelAll();
        if (signalled > 0) {
            log.info("Shutdown: cancellation signalled to {} running debates", signalled);
        }
    }
}
