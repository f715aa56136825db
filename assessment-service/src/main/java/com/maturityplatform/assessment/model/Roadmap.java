package com.maturityplatform.assessment.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Generated roadmap. {@code DRAFT} until published; a published row is never updated.
 *
 * initiatives: JSON-serialised {@code List<Initiative>}, in priority order
 */
@Data
@NoArgsConstructor
@Table("roadmaps")
public class Roadmap {

    public static final String DRAFT = "DRAFT";
    public static final String PUBLISHED = "PUBLISHED";

    @Id
    private Long id;

    private String tenantId;

    private Long assessmentId;

    private String status;

    private String catalogVersion;

    private Integer currentMaturityLevel;

    private Integer targetMaturityLevel;

    private Integer horizonMonths;

    private String initiatives;

    private LocalDateTime generatedAt;

    private LocalDateTime publishedAt;
}
