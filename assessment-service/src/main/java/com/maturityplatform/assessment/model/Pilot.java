package com.maturityplatform.assessment.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Persisted pilot.
 *
 * design: JSON-serialised {@link com.maturityplatform.common.pilot.PilotDesign}
 * executionLog: JSON-serialised {@code List<ExecutionLogEntry>}, append-only, ordered by week
 *
 * {@code version} serialises status transitions and log appends per pilot.
 */
@Data
@NoArgsConstructor
@Table("pilots")
public class Pilot {

    @Id
    private Long id;

    @Version
    private Long version;

    private String tenantId;

    private Long assessmentId;

    private Long roadmapId;

    /** Enum name of {@link com.maturityplatform.common.model.PilotStatus} */
    private String status;

    private String title;

    private String dimension;

    private Integer durationWeeks;

    private String design;

    private String executionLog;

    private Boolean atRisk;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    private LocalDateTime startedAt;

    private LocalDateTime closedAt;
}
