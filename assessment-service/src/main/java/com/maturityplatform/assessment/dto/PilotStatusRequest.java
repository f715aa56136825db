package com.maturityplatform.assessment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for PUT /api/v1/pilots/{id}/status.
 */
public record PilotStatusRequest(
    @JsonProperty("status") String status
) {}
