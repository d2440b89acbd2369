package com.debateplatform.engine.store;

import com.debateplatform.common.model.DebateState;
import com.debateplatform.common.model.EntityPair;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Writes every {@link DebateState} transition through to {@code debate_run}, so a cancelled or
 * crashed debate stays at its last persisted point.
 */
@Service
public class DebateRunStore {

    private static final Logger log = LoggerFactory.getLogger(DebateRunStore.class);

    private final DebateRunRepository repository;
    private final ObjectMapper objectMapper;

    public DebateRunStore(DebateRunRepository repository, ObjectMapper objectMapper) {
        this.repository   = repository;
        this.objectMapper = objectMapper;
    }

    public Mono<Void> save(DebateState state) {
        return Mono.fromCallable(() -> new Snapshot(
                writeJson(state.rounds()),
                state.result().map(this::writeJson).orElse(null)))
            .flatMap(json -> repository.upsert(
                state.debateId(),
                state.pair().kind().code(),
                state.pair().primaryId(),
                state.pair().secondaryId(),
                state.variantId(),
                state.status().name(),
                state.roundIndex(),
                state.maxRounds(),
                state.disagreement(),
                state.confidence(),
                state.contextFingerprint(),
                json.rounds(),
                json.result(),
                state.escalationReason() != null ? state.escalationReason().name() : null,
                state.statusReason(),
                state.totalTokens(),
                toUtc(state.startedAt()),
                toUtc(state.updatedAt()),
                toUtc(state.finishedAt())))
            .doOnSuccess(v -> log.debug("Debate run persisted. debateId={} status={} round={}",
                                        state.debateId(), state.status(), state.roundIndex()))
            .doOnError(e -> log.error("Failed to persist debate run. debateId={} status={}",
                                      state.debateId(), state.status(), e));
    }

    public Mono<DebateRunEntity> findLatest(EntityPair pair) {
        return repository.findLatestForPair(pair.kind().code(), pair.primaryId(), pair.secondaryId());
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("debate state not serializable", e);
        }
    }

    static LocalDateTime toUtc(Instant instant) {
        return instant == null ? null : LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private record Snapshot(String rounds, String result) {}
}
