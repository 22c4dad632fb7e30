package com.calibrationplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.Optional;

/**
 * One method at one graph node, under one execution context. Immutable.
 */
public record CalibrationSubject(
    @JsonProperty("method_id") String methodId,
    @JsonProperty("node_id")   String nodeId,
    @JsonProperty("role")      MethodRole role,
    @JsonProperty("context")   ExecutionContext context,
    @JsonProperty("interplay") InterplayGroup interplay
) {
    public CalibrationSubject {
        Objects.requireNonNull(methodId, "methodId");
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(context, "context");
    }

    public static CalibrationSubject of(String methodId, String nodeId, MethodRole role,
                                        ExecutionContext context) {
        return new CalibrationSubject(methodId, nodeId, role, context, null);
    }

    public Optional<InterplayGroup> interplayGroup() {
        return Optional.ofNullable(interplay);
    }
}
