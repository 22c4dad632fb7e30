package com.calibrationplatform.common.decision;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param layer layer symbol, {@code null} for score-level advice
 */
public record Recommendation(
    @JsonProperty("rank")   int rank,
    @JsonProperty("layer")  String layer,
    @JsonProperty("reason") FailureReason reason,
    @JsonProperty("action") String action
) {}
