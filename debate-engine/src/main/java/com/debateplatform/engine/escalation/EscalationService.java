package com.debateplatform.engine.escalation;

import com.debateplatform.common.model.DebateKind;
import com.debateplatform.common.model.DebateState;
import com.debateplatform.common.model.DebateStatus;
import com.debateplatform.common.model.EntityPair;
import com.debateplatform.common.model.EscalationDecision;
import com.debateplatform.common.model.EscalationReason;
import com.debateplatform.common.model.EscalationRecord;
import com.debateplatform.common.model.EscalationStatus;
import com.debateplatform.common.model.RoundRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Escalation sink: persists escalated debates for human review, lists them and applies
 * reviewer decisions.
 *
 * <p>Opening is idempotent per debate: while an open escalation exists for a debate id,
 * {@link #open(DebateState)} returns it instead of creating a second one.
 */
@Service
public class EscalationService {

    private static final Logger log = LoggerFactory.getLogger(EscalationService.class);

    private static final TypeReference<List<RoundRecord>> ROUNDS = new TypeReference<>() {};

    private final EscalationRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public EscalationService(EscalationRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository   = repository;
        this.objectMapper = objectMapper;
        this.clock        = clock;
    }

    public Mono<EscalationRecord> open(DebateState state) {
        if (state.status() != DebateStatus.ESCALATED) {
            return Mono.error(new IllegalStateException("debate " + state.debateId()
                + " is " + state.status() + ", only ESCALATED debates can be handed to review"));
        }
        return repository.findOpenByDebateId(state.debateId())
            .next()
            .map(this::toRecord)
            .doOnNext(existing -> log.info("Escalation already open. escalationId={} debateId={}",
                                           existing.id(), state.debateId()))
            .switchIfEmpty(Mono.defer(() -> {
                EscalationRecord record = EscalationRecord.open(UUID.randomUUID().toString(), state, clock.instant());
                return save(record)
                    .doOnSuccess(r -> log.info("ESCALATION_OPENED escalationId={} debateId={} pair={} reason={} description=\"{}\"",
                                               r.id(), r.debateId(), r.pair().key(), r.reason(), r.description()));
            }));
    }

    public Flux<EscalationRecord> list(EscalationFilter filter) {
        return repository.search(
                filter.status() != null ? filter.status().name() : null,
                filter.kind() != null ? filter.kind().code() : null,
                filter.entityId(),
                filter.limit())
            .map(this::toRecord);
    }

    /**
     * Applies a reviewer's decision.
     *
     * @return error {@link EscalationNotFoundException} for an unknown id,
     *         {@link IllegalStateException} when the escalation is already terminal
     */
    public Mono<EscalationRecord> resolve(String id, EscalationDecision decision) {
        return update(id, record -> record.decide(decision, clock.instant()))
            .doOnSuccess(r -> log.info("ESCALATION_RESOLVED escalationId={} debateId={} outcome={} by={}",
                                       r.id(), r.debateId(), r.status(), r.resolvedBy()));
    }

    public Mono<EscalationRecord> assign(String id, String reviewer) {
        return update(id, record -> record.assign(reviewer))
            .doOnSuccess(r -> log.info("ESCALATION_ASSIGNED escalationId={} assignedTo={}", r.id(), reviewer));
    }

    public Mono<Boolean> hasOpen(EntityPair pair) {
        return repository.existsOpenForPair(pair.kind().code(), pair.primaryId(), pair.secondaryId())
            .defaultIfEmpty(false);
    }

    private Mono<EscalationRecord> update(String id, UnaryOperator<EscalationRecord> change) {
        return repository.findById(id)
            .switchIfEmpty(Mono.error(() -> new EscalationNotFoundException(id)))
            .map(this::toRecord)
            .map(change)
            .flatMap(this::save);
    }

    private Mono<EscalationRecord> save(EscalationRecord r) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(r.rounds()))
            .flatMap(rounds -> repository.upsert(
                r.id(), r.debateId(), r.pair().kind().code(), r.pair().primaryId(), r.pair().secondaryId(),
                r.reason().name(), r.description(), rounds, r.status().name(),
                r.assignedTo(), r.resolution(), r.resolvedBy(),
                toUtc(r.createdAt()), toUtc(r.resolvedAt())))
            .thenReturn(r);
    }

    EscalationRecord toRecord(EscalationEntity e) {
        List<RoundRecord> rounds;
        try {
            rounds = e.getRounds() == null ? List.of() : objectMapper.readValue(e.getRounds(), ROUNDS);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("corrupt rounds column for escalation " + e.getId(), ex);
        }
        return new EscalationRecord(
            e.getId(),
            e.getDebateId(),
            EntityPair.of(e.getPrimaryId(), e.getSecondaryId(), DebateKind.fromCode(e.getKind())),
            EscalationReason.valueOf(e.getReason()),
            e.getDescription(),
            rounds,
            EscalationStatus.valueOf(e.getStatus()),
            e.getAssignedTo(),
            e.getResolution(),
            e.getResolvedBy(),
            toInstant(e.getCreatedAt()),
            toInstant(e.getResolvedAt()));
    }

    private static LocalDateTime toUtc(Instant instant) {
        return instant == null ? null : LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static Instant toInstant(LocalDateTime time) {
        return time == null ? null : time.toInstant(ZoneOffset.UTC);
    }
}
