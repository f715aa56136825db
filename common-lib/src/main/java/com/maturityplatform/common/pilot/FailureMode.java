package com.maturityplatform.common.pilot;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FailureMode(
    @JsonProperty("description") String description,
    @JsonProperty("mitigation") String mitigation
) {}
