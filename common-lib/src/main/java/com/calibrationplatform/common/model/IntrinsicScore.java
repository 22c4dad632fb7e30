package com.calibrationplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Externally supplied BASE-layer inputs for one method. The three components are
 * only meaningful when {@code status == COMPUTED}.
 */
public record IntrinsicScore(
    @JsonProperty("status")   IntrinsicStatus status,
    @JsonProperty("b_theory") double bTheory,
    @JsonProperty("b_impl")   double bImpl,
    @JsonProperty("b_deploy") double bDeploy
) {
    public static IntrinsicScore computed(double bTheory, double bImpl, double bDeploy) {
        return new IntrinsicScore(IntrinsicStatus.COMPUTED, bTheory, bImpl, bDeploy);
    }

    public static IntrinsicScore withStatus(IntrinsicStatus status) {
        return new IntrinsicScore(status, 0.0, 0.0, 0.0);
    }
}
