package com.debateplatform.engine.controller;

import com.debateplatform.common.model.DebateKind;
import com.debateplatform.common.model.EntityPair;
import com.debateplatform.engine.debate.DebateDispatcher;
import com.debateplatform.engine.debate.DebateQueryService;
import com.debateplatform.engine.debate.DebateResultView;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/debates")
public class DebateController {

    private final DebateDispatcher dispatcher;
    private final DebateQueryService queryService;

    public DebateController(DebateDispatcher dispatcher, DebateQueryService queryService) {
        this.dispatcher   = dispatcher;
        this.queryService = queryService;
    }

    public record DebateRequest(String primaryId, String secondaryId, String kind) {

        EntityPair toPair() {
            if (kind == null) {
                throw new IllegalArgumentException("kind is required");
            }
            return EntityPair.of(primaryId, secondaryId, DebateKind.fromCode(kind));
        }
    }

    /** Enqueues a debate; answers 202 with the id of the new or already running debate. */
    @PostMapping
    public Mono<ResponseEntity<Map<String, String>>> request(@RequestBody DebateRequest request) {
        return Mono.fromCallable(request::toPair)
            .flatMap(dispatcher::requestDebate)
            .map(id -> ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("debateId", id)));
    }

    @GetMapping("/result")
    public Mono<ResponseEntity<DebateResultView>> result(@RequestParam String primaryId,
                                                         @RequestParam String secondaryId,
                                                         @RequestParam String kind) {
        return Mono.fromCallable(() -> new DebateRequest(primaryId, secondaryId, kind).toPair())
            .flatMap(queryService::getResult)
            .map(ResponseEntity::ok);
    }
}
