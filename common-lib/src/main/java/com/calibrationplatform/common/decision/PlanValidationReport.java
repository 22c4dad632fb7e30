package com.calibrationplatform.common.decision;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record PlanValidationReport(
    @JsonProperty("plan_id")          String planId,
    @JsonProperty("overall_decision") DecisionOutcome overallDecision,
    @JsonProperty("pass_rate")        double passRate,
    @JsonProperty("passed")           int passed,
    @JsonProperty("failed")           int failed,
    @JsonProperty("conditional_pass") int conditionalPass,
    @JsonProperty("skipped")          int skipped,
    @JsonProperty("total")            int total,
    @JsonProperty("per_method")       List<Decision> perMethod
) {
    public PlanValidationReport {
        perMethod = List.copyOf(perMethod);
    }
}
