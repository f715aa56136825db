package com.maturityplatform.assessment.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Persisted assessment row. Score columns stay null until the assessment is scored;
 * once {@code status = COMPLETED} none of them is written again.
 *
 * dimensionWeights: JSON-serialised {@code Map<String, Double>}; null means the default table
 * metadata: JSON-serialised {@code Map<String, Object>}
 *
 * {@code version} is the optimistic-locking column guarding scoring against
 * concurrent response submission.
 */
@Data
@NoArgsConstructor
@Table("assessments")
public class Assessment {

    @Id
    private Long id;

    @Version
    private Long version;

    private String tenantId;

    private String organizationName;

    private String industry;

    private String organizationSize;

    /** Enum name of {@link com.maturityplatform.common.model.AssessmentStatus} */
    private String status;

    private String dimensionWeights;

    private String metadata;

    private Double dataScore;

    private Double processScore;

    private Double peopleScore;

    private Double technologyScore;

    private Double governanceScore;

    private Double overallScore;

    private Integer maturityLevel;

    private String maturityLabel;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    private LocalDateTime responsesUpdatedAt;

    private LocalDateTime completedAt;
}
