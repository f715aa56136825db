package com.maturityplatform.assessment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.maturityplatform.common.report.MaturityReport;

import java.time.LocalDateTime;

public record ReportDTO(
    @JsonProperty("id")          Long id,
    @JsonProperty("report")      MaturityReport report,
    @JsonProperty("generatedAt") LocalDateTime generatedAt
) {}
