package com.calibrationplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The task a method is being calibrated for.
 *
 * <p>{@code questionId}, {@code dimension} and {@code policyArea} may be {@code null};
 * a contextual layer that needs a missing key reports an evidence error.
 */
public record ExecutionContext(
    @JsonProperty("question_id")  String questionId,
    @JsonProperty("dimension")    String dimension,
    @JsonProperty("policy_area")  String policyArea,
    @JsonProperty("unit_quality") double unitQuality
) {
    public ExecutionContext {
        if (Double.isNaN(unitQuality) || unitQuality < 0.0 || unitQuality > 1.0) {
            throw new IllegalArgumentException(
                "unit_quality must be in [0,1], got " + unitQuality);
        }
    }
}
