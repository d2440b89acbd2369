package com.debateplatform.engine.scheduler;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/** Row of {@code batch_job}: the persisted {@link com.debateplatform.common.model.BatchReport}. */
@Data
@NoArgsConstructor
@Table("batch_job")
public class BatchJobEntity {

    @Id
    private String cycleId;

    private String mode;

    private String status;

    private LocalDateTime startedAt;

    private LocalDateTime finishedAt;

    private int processed;

    private int succeeded;

    private int escalated;

    private int failed;

    private int skipped;

    private int cancelled;

    private String error;
}
