package com.debateplatform.engine.entity;

import com.debateplatform.common.model.DebateContext;
import com.debateplatform.common.model.DebateKind;
import com.debateplatform.common.model.EntityPair;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * {@link EntityStore} over the entity store's HTTP API.
 *
 * <pre>
 *   GET /api/v1/pairs?kind=lp_match                        → [{primaryId, secondaryId}]
 *   GET /api/v1/pairs/changes?kind=lp_match&since=ISO-8601 → [{primaryId, secondaryId}]
 *   GET /api/v1/entities/{id}                              → profile object
 *   GET /api/v1/mutations/stream                           → SSE of {entityId, occurredAt}
 * </pre>
 */
@Component
public class RestEntityStore implements EntityStore {

    private static final Logger log = LoggerFactory.getLogger(RestEntityStore.class);

    private static final ParameterizedTypeReference<Map<String, Object>> PROFILE =
        new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<ServerSentEvent<EntityMutation>> MUTATION_EVENT =
        new ParameterizedTypeReference<>() {};

    private final WebClient entityStoreClient;
    private final Clock clock;

    public RestEntityStore(@Qualifier("entityStoreClient") WebClient entityStoreClient, Clock clock) {
        this.entityStoreClient = entityStoreClient;
        this.clock             = clock;
    }

    @Override
    public Flux<EntityPair> eligiblePairs(DebateKind kind) {
        return entityStoreClient.get()
            .uri(b -> b.path("/api/v1/pairs").queryParam("kind", kind.code()).build())
            .retrieve()
            .bodyToFlux(PairDto.class)
            .map(dto -> EntityPair.of(dto.primaryId(), dto.secondaryId(), kind))
            .doOnComplete(() -> log.debug("Eligible pairs enumerated. kind={}", kind.code()));
    }

    @Override
    public Flux<EntityPair> changedPairs(DebateKind kind, Instant since) {
        return entityStoreClient.get()
            .uri(b -> b.path("/api/v1/pairs/changes")
                .queryParam("kind", kind.code())
                .queryParam("since", since.toString())
                .build())
            .retrieve()
            .bodyToFlux(PairDto.class)
            .map(dto -> EntityPair.of(dto.primaryId(), dto.secondaryId(), kind));
    }

    @Override
    public Mono<DebateContext> loadContext(EntityPair pair) {
        // stamped before the reads: a mutation landing mid-load still marks this snapshot stale
        return Mono.defer(() -> {
            Instant readStart = clock.instant();
            return Mono.zip(profile(pair.primaryId()), profile(pair.secondaryId()))
                .map(t -> new DebateContext(pair, t.getT1(), t.getT2(), readStart));
        });
    }

    @Override
    public Flux<EntityMutation> mutations() {
        return entityStoreClient.get()
            .uri("/api/v1/mutations/stream")
            .accept(MediaType.TEXT_EVENT_STREAM)
            .retrieve()
            .bodyToFlux(MUTATION_EVENT)
            .map(ServerSentEvent::data)
            .filter(Objects::nonNull);
    }

    private Mono<Map<String, Object>> profile(String entityId) {
        return entityStoreClient.get()
            .uri("/api/v1/entities/{id}", entityId)
            .retrieve()
            .bodyToMono(PROFILE);
    }

    record PairDto(
        @JsonProperty("primaryId")   String primaryId,
        @JsonProperty("secondaryId") String secondaryId
    ) {}
}
