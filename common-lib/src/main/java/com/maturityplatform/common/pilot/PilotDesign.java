package com.maturityplatform.common.pilot;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.maturityplatform.common.model.Dimension;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural content of a pilot proposal. Checked by {@link PilotValidator}
 * before the pilot may be approved.
 *
 * @param stakeholders role → named stakeholder
 */
public record PilotDesign(
    @JsonProperty("title") String title,
    @JsonProperty("dimension") Dimension dimension,
    @JsonProperty("durationWeeks") int durationWeeks,
    @JsonProperty("successCriteria") List<SuccessCriterion> successCriteria,
    @JsonProperty("failureModes") List<FailureMode> failureModes,
    @JsonProperty("stakeholders") Map<String, String> stakeholders,
    @JsonProperty("resourceRequirements") Map<String, Object> resourceRequirements
) {
    public static final int DEFAULT_DURATION_WEEKS = 8;

    public PilotDesign {
        successCriteria = successCriteria == null ? List.of() : List.copyOf(successCriteria);
        failureModes = failureModes == null ? List.of() : List.copyOf(failureModes);
        stakeholders = stakeholders == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(stakeholders));
        resourceRequirements = resourceRequirements == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(resourceRequirements));
    }
}
