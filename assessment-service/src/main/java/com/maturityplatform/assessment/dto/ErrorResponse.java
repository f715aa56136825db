package com.maturityplatform.assessment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Error body returned for every mapped failure.
 *
 * @param retryable true only for optimistic-concurrency conflicts
 */
public record ErrorResponse(
    @JsonProperty("error")      String error,
    @JsonProperty("message")    String message,
    @JsonProperty("violations") List<String> violations,
    @JsonProperty("retryable")  boolean retryable
) {}
