package com.debateplatform.engine.scheduler;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface BatchJobRepository extends ReactiveCrudRepository<BatchJobEntity, String> {

    @Modifying
    @Query("""
        INSERT INTO batch_job
            (cycle_id, mode, status, started_at, finished_at, processed, succeeded,
             escalated, failed, skipped, cancelled, error)
        VALUES
            (:cycleId, :mode, :status, :startedAt, :finishedAt, :processed, :succeeded,
             :escalated, :failed, :skipped, :cancelled, :error)
        ON CONFLICT (cycle_id) DO UPDATE SET
            status      = :status,
            finished_at = :finishedAt,
            processed   = :processed,
            succeeded   = :succeeded,
            escalated   = :escalated,
            failed      = :failed,
            skipped     = :skipped,
            cancelled   = :cancelled,
            error       = :error
        """)
    Mono<Void> upsert(String cycleId, String mode, String status, LocalDateTime startedAt,
                      LocalDateTime finishedAt, int processed, int succeeded, int escalated,
                      int failed, int skipped, int cancelled, String error);

    /** Latest cycle, of either mode, that finished with status COMPLETED. */
    @Query("""
        SELECT * FROM batch_job
        WHERE status = 'COMPLETED'
        ORDER BY started_at DESC
        LIMIT 1
        """)
    Mono<BatchJobEntity> findLastSuccessful();

    @Query("SELECT * FROM batch_job ORDER BY started_at DESC LIMIT 1")
    Mono<BatchJobEntity> findLatest();
}
