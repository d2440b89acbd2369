package com.debateplatform.engine.scheduler;

import com.debateplatform.common.model.BatchMode;
import com.debateplatform.engine.cache.DebateResultCache;
import com.debateplatform.engine.config.DebateProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Periodic triggers: one loop per batch mode plus an expired-entry sweep of the result cache.
 *
 * <pre>
 *   delay(interval) → run cycle → log report → repeat
 * </pre>
 *
 * Each pass is a fresh {@link Mono} whose terminal subscriber schedules the next one, so a
 * failed cycle never stops the loop. A trigger that fires while a cycle is still running is
 * logged and skipped.
 */
@Component
public class BatchCycleJob {

    private static final Logger log = LoggerFactory.getLogger(BatchCycleJob.class);

    static final Duration CACHE_SWEEP_INTERVAL = Duration.ofMinutes(10);

    private final BatchScheduler scheduler;
    private final DebateResultCache resultCache;
    private final DebateProperties properties;

    private final Map<String, Disposable> pending = new ConcurrentHashMap<>();
    private volatile boolean stopped;

    public BatchCycleJob(BatchScheduler scheduler, DebateResultCache resultCache, DebateProperties properties) {
        this.scheduler   = scheduler;
        this.resultCache = resultCache;
        this.properties  = properties;
    }

    @PostConstruct
    public void start() {
        scheduleSweep();
        DebateProperties.Batch batch = properties.getBatch();
        if (!batch.isEnabled()) {
            log.info("Batch scheduling disabled (debate.batch.enabled=false)");
            return;
        }
        log.info("Batch scheduling started. incrementalInterval={} fullInterval={} kinds={}",
                 batch.getIncrementalInterval(), batch.getFullInterval(), batch.getKinds());
        scheduleCycle(BatchMode.INCREMENTAL, batch.getIncrementalInterval());
        scheduleCycle(BatchMode.FULL, batch.getFullInterval());
    }

    private void scheduleCycle(BatchMode mode, Duration interval) {
        if (stopped) {
            return;
        }
        pending.put(mode.name(), Mono.delay(interval)
            .then(scheduler.runCycle(mode))
            .subscribe(
                report -> scheduleCycle(mode, interval),
                err -> {
                    if (err instanceof BatchCycleInProgressException) {
                        log.info("Scheduled {} cycle skipped: {}", mode, err.getMessage());
                    } else {
                        log.error("Scheduled {} cycle failed, rescheduling", mode, err);
                    }
                    scheduleCycle(mode, interval);
                }));
    }

    private void scheduleSweep() {
        if (stopped) {
            return;
        }
        pending.put("sweep", Mono.delay(CACHE_SWEEP_INTERVAL)
            .map(tick -> resultCache.evictExpired())
            .subscribe(
                evicted -> {
                    if (evicted > 0) {
                        log.info("Result cache sweep evicted {} expired entries", evicted);
                    }
                    scheduleSweep();
                },
                err -> {
                    log.error("Result cache sweep failed", err);
                    scheduleSweep();
                }));
    }

    @PreDestroy
    public void stop() {
        stopped = true;
        scheduler.requestStop();
        pending.values().forEach(Disposable::dispose);
        log.info("Batch scheduling stopped");
    }
}
