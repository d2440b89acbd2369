package com.debateplatform.engine.escalation;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Row of {@code debate_escalation}. At most one row per debate may be open
 * (PENDING, ASSIGNED or IN_REVIEW); a partial unique index enforces it.
 */
@Data
@NoArgsConstructor
@Table("debate_escalation")
public class EscalationEntity {

    @Id
    private String id;

    private String debateId;

    private String kind;

    private String primaryId;

    private String secondaryId;

    private String reason;

    private String description;

    /** JSON-serialised {@code List<RoundRecord>} */
    private String rounds;

    private String status;

    private String assignedTo;

    private String resolution;

    private String resolvedBy;

    private LocalDateTime createdAt;

    private LocalDateTime resolvedAt;
}
