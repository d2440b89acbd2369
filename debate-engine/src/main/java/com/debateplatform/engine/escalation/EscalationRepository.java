package com.debateplatform.engine.escalation;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface EscalationRepository extends ReactiveCrudRepository<EscalationEntity, String> {

    @Modifying
    @Query("""
        INSERT INTO debate_escalation
            (id, debate_id, kind, primary_id, secondary_id, reason, description, rounds,
             status, assigned_to, resolution, resolved_by, created_at, resolved_at)
        VALUES
            (:id, :debateId, :kind, :primaryId, :secondaryId, :reason, :description, :rounds,
             :status, :assignedTo, :resolution, :resolvedBy, :createdAt, :resolvedAt)
        ON CONFLICT (id) DO UPDATE SET
            status      = :status,
            assigned_to = :assignedTo,
            resolution  = :resolution,
            resolved_by = :resolvedBy,
            resolved_at = :resolvedAt
        """)
    Mono<Void> upsert(String id, String debateId, String kind, String primaryId, String secondaryId,
                      String reason, String description, String rounds, String status,
                      String assignedTo, String resolution, String resolvedBy,
                      LocalDateTime createdAt, LocalDateTime resolvedAt);

    @Query("""
        SELECT * FROM debate_escalation
        WHERE debate_id = :debateId
          AND status IN ('PENDING', 'ASSIGNED', 'IN_REVIEW')
        """)
    Flux<EscalationEntity> findOpenByDebateId(String debateId);

    @Query("""
        SELECT COUNT(*) > 0 FROM debate_escalation
        WHERE kind = :kind AND primary_id = :primaryId AND secondary_id = :secondaryId
          AND status IN ('PENDING', 'ASSIGNED', 'IN_REVIEW')
        """)
    Mono<Boolean> existsOpenForPair(String kind, String primaryId, String secondaryId);

    /** Every filter argument is optional; {@code null} matches all rows. */
    @Query("""
        SELECT * FROM debate_escalation
        WHERE (:status IS NULL OR status = :status)
          AND (:kind IS NULL OR kind = :kind)
          AND (:entityId IS NULL OR primary_id = :entityId OR secondary_id = :entityId)
        ORDER BY created_at DESC
        LIMIT :limit
        """)
    Flux<EscalationEntity> search(String status, String kind, String entityId, int limit);
}
