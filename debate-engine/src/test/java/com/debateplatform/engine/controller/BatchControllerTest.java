package com.debateplatform.engine.controller;

import com.debateplatform.common.model.BatchMode;
import com.debateplatform.common.model.BatchReport;
import com.debateplatform.engine.scheduler.BatchCycleInProgressException;
import com.debateplatform.engine.scheduler.BatchJobStore;
import com.debateplatform.engine.scheduler.BatchScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import static com.debateplatform.engine.DebateFixtures.NOW;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BatchControllerTest {

    private BatchScheduler scheduler;
    private BatchJobStore jobStore;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        scheduler = mock(BatchScheduler.class);
        jobStore  = mock(BatchJobStore.class);
        client = WebTestClient.bindToController(new BatchController(scheduler, jobStore))
            .controllerAdvice(new GlobalErrorHandler())
            .build();
    }

    private static BatchReport report() {
        return new BatchReport("cycle-1", BatchMode.FULL, BatchReport.Status.COMPLETED, NOW, NOW.plusSeconds(90),
            4, 3, 1, 0, 2, 0, null);
    }

    @Test
    void runsRequestedMode() {
        when(scheduler.runCycle(BatchMode.FULL)).thenReturn(Mono.just(report()));

        client.post().uri("/api/v1/batch/cycles?mode=full")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.cycleId").isEqualTo("cycle-1")
            .jsonPath("$.processed").isEqualTo(4)
            .jsonPath("$.successful").doesNotExist();
    }

    @Test
    void overlappingCycleConflicts() {
        when(scheduler.runCycle(BatchMode.INCREMENTAL))
            .thenReturn(Mono.error(new BatchCycleInProgressException("cycle-0")));

        client.post().uri("/api/v1/batch/cycles")
            .exchange()
            .expectStatus().isEqualTo(409);
    }

    @Test
    void unknownModeIsBadRequest() {
        client.post().uri("/api/v1/batch/cycles?mode=weekly")
            .exchange()
            .expectStatus().isBadRequest();
    }

    @Test
    void latestIsNotFoundBeforeAnyCycle() {
        when(jobStore.latest()).thenReturn(Mono.empty());

        client.get().uri("/api/v1/batch/cycles/latest")
            .exchange()
            .expectStatus().isNotFound();
    }
}
