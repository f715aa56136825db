package com.maturityplatform.assessment.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One answered question. Unique per (assessment_id, question_id); a resubmitted
 * question replaces the earlier row.
 */
@Data
@NoArgsConstructor
@Table("assessment_responses")
public class AssessmentResponse {

    @Id
    private Long id;

    private Long assessmentId;

    private String questionId;

    /** Wire key of {@link com.maturityplatform.common.model.Dimension} */
    private String dimension;

    private Double numericScore;

    /** Null means equal weight within the dimension. */
    private Double weight;

    private String responseValue;

    private LocalDateTime createdAt;
}
