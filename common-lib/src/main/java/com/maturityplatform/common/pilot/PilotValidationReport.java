package com.maturityplatform.common.pilot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Outcome of the approval gate; {@code violations} is empty when the gate passes. */
@JsonIgnoreProperties(value = "valid", allowGetters = true)
public record PilotValidationReport(
    @JsonProperty("violations") List<String> violations
) {
    public PilotValidationReport {
        violations = List.copyOf(violations);
    }

    @JsonProperty("valid")
    public boolean valid() {
        return violations.isEmpty();
    }
}
