package com.maturityplatform.common.pilot;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Advisory at-risk flag derived from the execution log. Informational only:
 * it never changes the pilot status.
 */
public record RiskSignal(
    @JsonProperty("atRisk") boolean atRisk,
    @JsonProperty("reasons") List<String> reasons
) {
    public static final RiskSignal CLEAR = new RiskSignal(false, List.of());

    public RiskSignal {
        reasons = List.copyOf(reasons);
    }
}
