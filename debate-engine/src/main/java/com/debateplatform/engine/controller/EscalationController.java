package com.debateplatform.engine.controller;

import com.debateplatform.common.model.DebateKind;
import com.debateplatform.common.model.EscalationDecision;
import com.debateplatform.common.model.EscalationRecord;
import com.debateplatform.common.model.EscalationStatus;
import com.debateplatform.engine.escalation.EscalationFilter;
import com.debateplatform.engine.escalation.EscalationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/** Review queue endpoints. */
@RestController
@RequestMapping("/api/v1/escalations")
public class EscalationController {

    private final EscalationService escalationService;

    public EscalationController(EscalationService escalationService) {
        this.escalationService = escalationService;
    }

    public record AssignRequest(String reviewer) {}

    @GetMapping
    public Flux<EscalationRecord> list(@RequestParam(required = false) String status,
                                       @RequestParam(required = false) String kind,
                                       @RequestParam(required = false) String entityId,
                                       @RequestParam(defaultValue = "100") int limit) {
        return Mono.fromCallable(() -> new EscalationFilter(
                status != null ? EscalationStatus.valueOf(status.toUpperCase()) : null,
                kind != null ? DebateKind.fromCode(kind) : null,
                entityId,
                limit))
            .flatMapMany(escalationService::list);
    }

    @PostMapping("/{id}/resolve")
    public Mono<ResponseEntity<EscalationRecord>> resolve(@PathVariable String id,
                                                          @RequestBody EscalationDecision decision) {
        return escalationService.resolve(id, decision).map(ResponseEntity::ok);
    }

    @PostMapping("/{id}/assign")
    public Mono<ResponseEntity<EscalationRecord>> assign(@PathVariable String id,
                                                         @RequestBody AssignRequest request) {
        if (request.reviewer() == null || request.reviewer().isBlank()) {
            return Mono.error(new IllegalArgumentException("reviewer must not be blank"));
        }
        return escalationService.assign(id, request.reviewer()).map(ResponseEntity::ok);
    }
}
