package com.calibrationplatform.calibration.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record PlanValidationRequest(
    @JsonProperty("plan_id")  String planId,
    @JsonProperty("trace_id") String traceId,
    @JsonProperty("subjects") List<CalibrationRequest> subjects
) {
    public PlanValidationRequest {
        subjects = subjects == null ? List.of() : List.copyOf(subjects);
    }
}
