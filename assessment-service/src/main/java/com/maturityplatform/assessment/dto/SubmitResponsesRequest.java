package com.maturityplatform.assessment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request body for POST /api/v1/assessments/{id}/responses.
 */
public record SubmitResponsesRequest(
    @JsonProperty("responses") List<ResponseItem> responses
) {}
