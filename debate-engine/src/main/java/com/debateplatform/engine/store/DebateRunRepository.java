package com.debateplatform.engine.store;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface DebateRunRepository extends ReactiveCrudRepository<DebateRunEntity, String> {

    /**
     * Idempotent write of the current run snapshot, keyed by {@code debate_id}.
     * Identity columns (kind, pair, variant, started_at) are only written on insert.
     */
    @Modifying
    @Query("""
        INSERT INTO debate_run
            (debate_id, kind, primary_id, secondary_id, variant_id, status, round_index, max_rounds,
             disagreement, confidence, context_fingerprint, rounds, result, escalation_reason,
             status_reason, total_tokens, started_at, updated_at, finished_at)
        VALUES
            (:debateId, :kind, :primaryId, :secondaryId, :variantId, :status, :roundIndex, :maxRounds,
             :disagreement, :confidence, :contextFingerprint, :rounds, :result, :escalationReason,
             :statusReason, :totalTokens, :startedAt, :updatedAt, :finishedAt)
        ON CONFLICT (debate_id) DO UPDATE SET
            status            = :status,
            round_index       = :roundIndex,
            disagreement      = :disagreement,
            confidence        = :confidence,
            rounds            = :rounds,
            result            = :result,
            escalation_reason = :escalationReason,
            status_reason     = :statusReason,
            total_tokens      = :totalTokens,
            updated_at        = :updatedAt,
            finished_at       = :finishedAt
        """)
    Mono<Void> upsert(String debateId, String kind, String primaryId, String secondaryId, String variantId,
                      String status, int roundIndex, int maxRounds, Double disagreement, Double confidence,
                      String contextFingerprint, String rounds, String result, String escalationReason,
                      String statusReason, int totalTokens, LocalDateTime startedAt,
                      LocalDateTime updatedAt, LocalDateTime finishedAt);

    /** Most recently started run for the pair and kind. */
    @Query("""
        SELECT * FROM debate_run
        WHERE kind = :kind AND primary_id = :primaryId AND secondary_id = :secondaryId
        ORDER BY started_at DESC
        LIMIT 1
        """)
    Mono<DebateRunEntity> findLatestForPair(String kind, String primaryId, String secondaryId);
}
