package com.maturityplatform.assessment.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Stored report. Regenerated as a new row, never edited.
 *
 * content: JSON-serialised {@link com.maturityplatform.common.report.MaturityReport}
 */
@Data
@NoArgsConstructor
@Table("reports")
public class Report {

    @Id
    private Long id;

    private String tenantId;

    private Long assessmentId;

    private Long roadmapId;

    private Long pilotId;

    private String reportType;

    private String content;

    private LocalDateTime generatedAt;
}
