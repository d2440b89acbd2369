package com.debateplatform.engine.escalation;

import com.debateplatform.common.model.DebateState;
import com.debateplatform.common.model.EscalationDecision;
import com.debateplatform.common.model.EscalationReason;
import com.debateplatform.common.model.EscalationStatus;
import com.debateplatform.common.model.RoundRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static com.debateplatform.engine.DebateFixtures.NOW;
import static com.debateplatform.engine.DebateFixtures.PAIR;
import static com.debateplatform.engine.DebateFixtures.bear;
import static com.debateplatform.engine.DebateFixtures.bull;
import static com.debateplatform.engine.DebateFixtures.synthesis;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EscalationServiceTest {

    private EscalationRepository repository;
    private EscalationService service;

    @BeforeEach
    void setUp() {
        repository = mock(EscalationRepository.class);
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        service = new EscalationService(repository, objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));

        when(repository.upsert(any(), any(), any(), any(), any(), any(), any(), any(), any(),
                               any(), any(), any(), any(), any())).thenReturn(Mono.empty());
        when(repository.findOpenByDebateId(any())).thenReturn(Flux.empty());
    }

    private static DebateState escalatedState() {
        DebateState state = DebateState.start("debate-7", PAIR, "default-v1", 1, "fp", NOW);
        state.beginRound(NOW);
        state.beginSynthesis(NOW);
        state.recordRound(new RoundRecord(1, bull(1, 90, 0.8), bear(1, 40, 0.8), synthesis(1), 50.0, 0.8), NOW);
        state.escalate(EscalationReason.MAJOR_DISAGREEMENT,
                       "max rounds exceeded at round 1, disagreement = 50.0 (threshold 20.0)", NOW);
        return state;
    }

    private static EscalationEntity entity(String id, EscalationStatus status) {
        EscalationEntity e = new EscalationEntity();
        e.setId(id);
        e.setDebateId("debate-7");
        e.setKind(PAIR.kind().code());
        e.setPrimaryId(PAIR.primaryId());
        e.setSecondaryId(PAIR.secondaryId());
        e.setReason(EscalationReason.MAJOR_DISAGREEMENT.name());
        e.setDescription("max rounds exceeded");
        e.setRounds("[]");
        e.setStatus(status.name());
        e.setCreatedAt(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
        return e;
    }

    @Nested
    @DisplayName("open")
    class Open {

        @Test
        @DisplayName("creates a PENDING escalation carrying the full round history")
        void opensPending() {
            StepVerifier.create(service.open(escalatedState()))
                .assertNext(r -> {
                    assertThat(r.status()).isEqualTo(EscalationStatus.PENDING);
                    assertThat(r.debateId()).isEqualTo("debate-7");
                    assertThat(r.reason()).isEqualTo(EscalationReason.MAJOR_DISAGREEMENT);
                    assertThat(r.rounds()).hasSize(1);
                    assertThat(r.description()).contains("disagreement = 50.0");
                })
                .verifyComplete();

            verify(repository).upsert(any(), eq("debate-7"), eq("lp_match"), eq("fund-1"), eq("lp-9"),
                eq("MAJOR_DISAGREEMENT"), any(), any(), eq("PENDING"), isNull(), isNull(), isNull(), any(), isNull());
        }

        @Test
        @DisplayName("returns the existing open escalation instead of a second one")
        void idempotentPerDebate() {
            when(repository.findOpenByDebateId("debate-7")).thenReturn(Flux.just(entity("esc-1", EscalationStatus.PENDING)));

            StepVerifier.create(service.open(escalatedState()))
                .assertNext(r -> assertThat(r.id()).isEqualTo("esc-1"))
                .verifyComplete();

            verify(repository, never()).upsert(any(), any(), any(), any(), any(), any(), any(), any(), any(),
                                               any(), any(), any(), any(), any());
        }

        @Test
        void rejectsNonEscalatedDebate() {
            DebateState running = DebateState.start("debate-8", PAIR, "default-v1", 3, "fp", NOW);

            StepVerifier.create(service.open(running))
                .expectError(IllegalStateException.class)
                .verify();
        }
    }

    @Nested
    @DisplayName("review")
    class Review {

        @Test
        void resolveAppliesDecision() {
            when(repository.findById("esc-1")).thenReturn(Mono.just(entity("esc-1", EscalationStatus.ASSIGNED)));

            StepVerifier.create(service.resolve("esc-1",
                    new EscalationDecision(EscalationStatus.RESOLVED, "approved: strong fit", "analyst@firm")))
                .assertNext(r -> {
                    assertThat(r.status()).isEqualTo(EscalationStatus.RESOLVED);
                    assertThat(r.resolvedBy()).isEqualTo("analyst@firm");
                    assertThat(r.resolvedAt()).isEqualTo(NOW);
                })
                .verifyComplete();
        }

        @Test
        void resolveUnknownIdIsNotFound() {
            when(repository.findById("missing")).thenReturn(Mono.empty());

            StepVerifier.create(service.resolve("missing",
                    new EscalationDecision(EscalationStatus.DISMISSED, null, "analyst@firm")))
                .expectError(EscalationNotFoundException.class)
                .verify();
        }

        @Test
        @DisplayName("a resolved escalation cannot be decided again")
        void terminalEscalationRejected() {
            when(repository.findById("esc-1")).thenReturn(Mono.just(entity("esc-1", EscalationStatus.RESOLVED)));

            StepVerifier.create(service.assign("esc-1", "reviewer-2"))
                .expectError(IllegalStateException.class)
                .verify();
        }

        @Test
        void listPassesTypedFilters() {
            when(repository.search(eq("PENDING"), isNull(), eq("fund-1"), anyInt()))
                .thenReturn(Flux.just(entity("esc-1", EscalationStatus.PENDING)));

            StepVerifier.create(service.list(new EscalationFilter(EscalationStatus.PENDING, null, "fund-1", 0)))
                .assertNext(r -> assertThat(r.pair()).isEqualTo(PAIR))
                .verifyComplete();

            verify(repository).search(eq("PENDING"), isNull(), eq("fund-1"), eq(EscalationFilter.DEFAULT_LIMIT));
        }
    }
}
