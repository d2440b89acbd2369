package com.debateplatform.engine.controller;

import com.debateplatform.engine.entity.EntityChangeFeedListener;
import com.debateplatform.engine.entity.EntityMutation;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Map;

/**
 * Push-style invalidation for entity stores that call back on change instead of
 * streaming mutations.
 */
@RestController
@RequestMapping("/api/v1/entities")
public class EntityMutationController {

    private final EntityChangeFeedListener changeFeed;

    public EntityMutationController(EntityChangeFeedListener changeFeed) {
        this.changeFeed = changeFeed;
    }

    public record MutationNotice(Instant occurredAt) {}

    @PostMapping("/{entityId}/mutations")
    public ResponseEntity<Map<String, Integer>> mutated(@PathVariable String entityId,
                                                        @RequestBody(required = false) MutationNotice notice) {
        Instant occurredAt = notice != null ? notice.occurredAt() : null;
        int invalidated = changeFeed.onMutation(new EntityMutation(entityId, occurredAt));
        return ResponseEntity.ok(Map.of("invalidated", invalidated));
    }
}
