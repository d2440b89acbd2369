package com.debateplatform.engine.controller;

import com.debateplatform.common.model.BatchMode;
import com.debateplatform.common.model.BatchReport;
import com.debateplatform.engine.scheduler.BatchJobStore;
import com.debateplatform.engine.scheduler.BatchScheduler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/batch/cycles")
public class BatchController {

    private final BatchScheduler scheduler;
    private final BatchJobStore jobStore;

    public BatchController(BatchScheduler scheduler, BatchJobStore jobStore) {
        this.scheduler = scheduler;
        this.jobStore  = jobStore;
    }

    /** Runs a cycle to completion and returns its report; 409 while another cycle runs. */
    @PostMapping
    public Mono<ResponseEntity<BatchReport>> run(@RequestParam(defaultValue = "INCREMENTAL") String mode) {
        return Mono.fromCallable(() -> BatchMode.valueOf(mode.toUpperCase()))
            .flatMap(scheduler::runCycle)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/latest")
    public Mono<ResponseEntity<BatchReport>> latest() {
        return jobStore.latest()
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }
}
