package com.maturityplatform.assessment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record BenchmarkCompareRequest(
    @JsonProperty("assessmentId") Long assessmentId
) {}
