package com.debateplatform.engine.store;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Persisted snapshot of one {@link com.debateplatform.common.model.DebateState}, rewritten on
 * every transition. Timestamps are UTC.
 *
 * rounds: JSON-serialised {@code List<RoundRecord>}
 * result: JSON-serialised {@code DebateResult}, only once COMPLETED
 */
@Data
@NoArgsConstructor
@Table("debate_run")
public class DebateRunEntity {

    @Id
    private String debateId;

    private String kind;

    private String primaryId;

    private String secondaryId;

    private String variantId;

    private String status;

    private int roundIndex;

    private int maxRounds;

    private Double disagreement;

    private Double confidence;

    private String contextFingerprint;

    /** JSON-serialised {@code List<RoundRecord>} */
    private String rounds;

    /** JSON-serialised {@code DebateResult} */
    private String result;

    private String escalationReason;

    private String statusReason;

    private int totalTokens;

    private LocalDateTime startedAt;

    private LocalDateTime updatedAt;

    private LocalDateTime finishedAt;
}
