package com.debateplatform.engine.scheduler;

import com.debateplatform.common.model.BatchMode;
import com.debateplatform.common.model.BatchReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Persists batch reports and serves the incremental watermark: the start time of the
 * last COMPLETED cycle.
 */
@Service
public class BatchJobStore {

    private static final Logger log = LoggerFactory.getLogger(BatchJobStore.class);

    private final BatchJobRepository repository;

    public BatchJobStore(BatchJobRepository repository) {
        this.repository = repository;
    }

    public Mono<BatchReport> save(BatchReport report) {
        return repository.upsert(
                report.cycleId(), report.mode().name(), report.status().name(),
                toUtc(report.startedAt()), toUtc(report.finishedAt()),
                report.processed(), report.succeeded(), report.escalated(),
                report.failed(), report.skipped(), report.cancelled(), report.error())
            .doOnError(e -> log.error("Failed to persist batch report. cycleId={}", report.cycleId(), e))
            .thenReturn(report);
    }

    /** Empty when no cycle has completed yet. */
    public Mono<Instant> lastSuccessfulStart() {
        return repository.findLastSuccessful()
            .map(e -> e.getStartedAt().toInstant(ZoneOffset.UTC));
    }

    public Mono<BatchReport> latest() {
        return repository.findLatest().map(BatchJobStore::toReport);
    }

    static BatchReport toReport(BatchJobEntity e) {
        return new BatchReport(
            e.getCycleId(),
            BatchMode.valueOf(e.getMode()),
            BatchReport.Status.valueOf(e.getStatus()),
            toInstant(e.getStartedAt()),
            toInstant(e.getFinishedAt()),
            e.getProcessed(),
            e.getSucceeded(),
            e.getEscalated(),
            e.getFailed(),
            e.getSkipped(),
            e.getCancelled(),
            e.getError());
    }

    private static LocalDateTime toUtc(Instant instant) {
        return instant == null ? null : LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static Instant toInstant(LocalDateTime time) {
        return time == null ? null : time.toInstant(ZoneOffset.UTC);
    }
}
