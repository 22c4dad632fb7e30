package com.calibrationplatform.calibration.dto;

import com.calibrationplatform.common.evidence.EvidenceBundle;
import com.calibrationplatform.common.model.CalibrationSubject;
import com.calibrationplatform.common.model.ExecutionContext;
import com.calibrationplatform.common.model.InterplayGroup;
import com.calibrationplatform.common.model.MethodRole;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One subject to calibrate. {@code role} is case-insensitive ({@code "analyzer"}).
 */
public record CalibrationRequest(
    @JsonProperty("trace_id")  String traceId,
    @JsonProperty("method_id") String methodId,
    @JsonProperty("node_id")   String nodeId,
    @JsonProperty("role")      String role,
    @JsonProperty("context")   ExecutionContext context,
    @JsonProperty("interplay") InterplayGroup interplay,
    @JsonProperty("evidence")  EvidenceDocument evidence
) {
    /**
     * @throws IllegalArgumentException when a mandatory field is missing or the role is unknown
     */
    public CalibrationSubject toSubject() {
        if (methodId == null || nodeId == null || role == null || context == null) {
            throw new IllegalArgumentException("method_id, node_id, role and context are required");
        }
        return new CalibrationSubject(methodId, nodeId, MethodRole.fromKey(role), context, interplay);
    }

    public EvidenceBundle toEvidence() {
        return evidence == null ? EvidenceBundle.empty() : evidence.toBundle();
    }
}
