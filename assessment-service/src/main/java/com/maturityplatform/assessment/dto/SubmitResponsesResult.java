package com.maturityplatform.assessment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SubmitResponsesResult(
    @JsonProperty("assessmentId")   Long assessmentId,
    @JsonProperty("submittedCount") int submittedCount,
    @JsonProperty("status")         String status
) {}
