package com.debateplatform.engine.scheduler;

import com.debateplatform.common.model.BatchMode;
import com.debateplatform.common.model.BatchReport;
import com.debateplatform.common.model.CacheKey;
import com.debateplatform.common.model.DebateKind;
import com.debateplatform.common.model.DebateOutcome;
import com.debateplatform.common.model.EntityPair;
import com.debateplatform.engine.cache.DebateResultCache;
import com.debateplatform.engine.config.DebateProperties;
import com.debateplatform.engine.debate.DebateDispatcher;
import com.debateplatform.engine.debate.InFlightRegistry;
import com.debateplatform.engine.entity.EntityStore;
import com.debateplatform.engine.escalation.EscalationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs batch cycles: enumerates candidate pairs, skips those that need no debate and runs the
 * rest with bounded parallelism.
 *
 * <p>A pair is skipped when it is already in flight, has an open escalation, or holds a valid
 * cache entry for its current input fingerprint. Re-running an INCREMENTAL cycle right after a
 * COMPLETED one therefore schedules nothing.
 *
 * <p>INCREMENTAL cycles enumerate pairs changed since the start of the last COMPLETED cycle;
 * with no such cycle on record they fall back to every eligible pair. Only one cycle runs at
 * a time.
 */
@Service
public class BatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(BatchScheduler.class);

    private final EntityStore entityStore;
    private final DebateDispatcher dispatcher;
    private final InFlightRegistry inFlight;
    private final EscalationService escalationService;
    private final DebateResultCache resultCache;
    private final BatchJobStore jobStore;
    private final DebateProperties properties;
    private final Clock clock;

    private final AtomicReference<String> runningCycle = new AtomicReference<>();
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    public BatchScheduler(EntityStore entityStore,
                          DebateDispatcher dispatcher,
                          InFlightRegistry inFlight,
                          EscalationService escalationService,
                          DebateResultCache resultCache,
                          BatchJobStore jobStore,
                          DebateProperties properties,
                          Clock clock) {
        this.entityStore       = entityStore;
        this.dispatcher        = dispatcher;
        this.inFlight          = inFlight;
        this.escalationService = escalationService;
        this.resultCache       = resultCache;
        this.jobStore          = jobStore;
        this.properties        = properties;
        this.clock             = clock;
    }

    /**
     * Runs one cycle to completion and persists its report.
     *
     * @return the report, or error {@link BatchCycleInProgressException} while another cycle runs
     */
    public Mono<BatchReport> runCycle(BatchMode mode) {
        return Mono.defer(() -> {
            String cycleId = UUID.randomUUID().toString();
            if (!runningCycle.compareAndSet(null, cycleId)) {
                return Mono.error(new BatchCycleInProgressException(runningCycle.get()));
            }
            // a stop applies to the cycle it interrupted only
            stopRequested.set(false);
            Instant startedAt = clock.instant();
            Counters counters = new Counters();
            log.info("BATCH_CYCLE_STARTED cycleId={} mode={}", cycleId, mode);

            return enumerate(mode)
                .collectList()
                .flatMap(pairs -> Flux.fromIterable(pairs)
                    .flatMap(pair -> process(pair, counters), Math.max(1, properties.getParallelism()))
                    .then(Mono.fromCallable(() -> counters.report(cycleId, mode, startedAt, clock.instant(),
                                                                  stopRequested.get()))))
                .onErrorResume(e -> {
                    log.error("Batch enumeration failed. cycleId={} mode={}", cycleId, mode, e);
                    return Mono.just(new BatchReport(cycleId, mode, BatchReport.Status.FAILED, startedAt,
                                                     clock.instant(), 0, 0, 0, 0, 0, 0, e.getMessage()));
                })
                .flatMap(jobStore::save)
                .doOnNext(r -> log.info("BATCH_CYCLE_FINISHED cycleId={} mode={} status={} processed={} succeeded={} "
                                        + "escalated={} failed={} skipped={} cancelled={}",
                                        r.cycleId(), r.mode(), r.status(), r.processed(), r.succeeded(),
                                        r.escalated(), r.failed(), r.skipped(), r.cancelled()))
                .doFinally(signal -> runningCycle.compareAndSet(cycleId, null));
        });
    }

    /** Stops the running cycle from starting further debates. */
    public void requestStop() {
        stopRequested.set(true);
    }

    public Optional<String> runningCycleId() {
        return Optional.ofNullable(runningCycle.get());
    }

    private Flux<EntityPair> enumerate(BatchMode mode) {
        List<DebateKind> kinds = properties.getBatch().getKinds().stream().map(DebateKind::fromCode).toList();
        Mono<Optional<Instant>> watermark = mode == BatchMode.FULL
            ? Mono.just(Optional.empty())
            : jobStore.lastSuccessfulStart().map(Optional::of).defaultIfEmpty(Optional.empty());

        return watermark.flatMapMany(since -> {
            if (mode == BatchMode.INCREMENTAL && since.isEmpty()) {
                log.info("No completed cycle on record, incremental cycle enumerates every eligible pair");
            }
            return Flux.fromIterable(kinds)
                .concatMap(kind -> since.isPresent()
                    ? entityStore.changedPairs(kind, since.get())
                    : entityStore.eligiblePairs(kind));
        }).distinct(EntityPair::key);
    }

    private Mono<Void> process(EntityPair pair, Counters counters) {
        if (stopRequested.get()) {
            return Mono.empty();
        }
        if (inFlight.isInFlight(pair)) {
            return skip(pair, "in flight", counters);
        }
        return escalationService.hasOpen(pair)
            .flatMap(open -> open ? skip(pair, "open escalation", counters) : debate(pair, counters))
            .onErrorResume(e -> {
                log.warn("Batch debate failed. pair={} reason={}", pair.key(), e.getMessage());
                counters.processed.incrementAndGet();
                counters.failed.incrementAndGet();
                return Mono.empty();
            });
    }

    private Mono<Void> debate(EntityPair pair, Counters counters) {
        return entityStore.loadContext(pair)
            .flatMap(context -> {
                if (resultCache.get(CacheKey.of(context)).isPresent()) {
                    return skip(pair, "cache hit", counters);
                }
                return dispatcher.runExclusive(context)
                    .doOnNext(counters::record)
                    .switchIfEmpty(Mono.fromRunnable(() -> skip(pair, "in flight", counters)))
                    .then();
            });
    }

    private Mono<Void> skip(EntityPair pair, String why, Counters counters) {
        log.debug("Batch skipped pair. pair={} reason={}", pair.key(), why);
        counters.skipped.incrementAndGet();
        return Mono.empty();
    }

    private static final class Counters {
        final AtomicInteger processed = new AtomicInteger();
        final AtomicInteger succeeded = new AtomicInteger();
        final AtomicInteger escalated = new AtomicInteger();
        final AtomicInteger failed    = new AtomicInteger();
        final AtomicInteger skipped   = new AtomicInteger();
        final AtomicInteger cancelled = new AtomicInteger();

        void record(DebateOutcome outcome) {
            processed.incrementAndGet();
            if (outcome instanceof DebateOutcome.Completed) {
                succeeded.incrementAndGet();
            } else if (outcome instanceof DebateOutcome.Escalated) {
                escalated.incrementAndGet();
            } else {
                cancelled.incrementAndGet();
            }
        }

        BatchReport report(String cycleId, BatchMode mode, Instant startedAt, Instant finishedAt, boolean stopped) {
            BatchReport.Status status;
            if (stopped || cancelled.get() > 0) {
                status = BatchReport.Status.CANCELLED;
            } else if (failed.get() > 0) {
                status = BatchReport.Status.COMPLETED_WITH_FAILURES;
            } else {
                status = BatchReport.Status.COMPLETED;
            }
            return new BatchReport(cycleId, mode, status, startedAt, finishedAt,
                                   processed.get(), succeeded.get(), escalated.get(),
                                   failed.get(), skipped.get(), cancelled.get(), null);
        }
    }
}
