package com.maturityplatform.assessment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AssessmentPageDTO(
    @JsonProperty("items")    List<AssessmentDTO> items,
    @JsonProperty("total")    long total,
    @JsonProperty("page")     int page,
    @JsonProperty("pageSize") int pageSize
) {}
