package com.calibrationplatform.common.decision;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of validating one certificate (or of skipping a subject).
 *
 * <p>FAIL always carries {@code failureReason} and at least one recommendation;
 * SKIPPED always carries {@code status}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Decision(
    @JsonProperty("method_id")       String methodId,
    @JsonProperty("node_id")         String nodeId,
    @JsonProperty("outcome")         DecisionOutcome outcome,
    @JsonProperty("score")           double score,
    @JsonProperty("threshold")       double threshold,
    @JsonProperty("failure_reason")  FailureReason failureReason,
    @JsonProperty("failed_layer")    String failedLayer,
    @JsonProperty("details")         String details,
    @JsonProperty("recommendations") List<Recommendation> recommendations,
    @JsonProperty("status")          String status
) {
    public Decision {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public static Decision skipped(String methodId, String nodeId, String status) {
        return new Decision(methodId, nodeId, DecisionOutcome.SKIPPED, 0.0, 0.0,
            null, null, "calibration skipped: " + status, List.of(), status);
    }

    /** Unexpected failure while calibrating; never reported as anything but FAIL. */
    public static Decision error(String methodId, String nodeId, double threshold, String message) {
        FailureReason reason = FailureReason.SCORE_BELOW_THRESHOLD;
        return new Decision(methodId, nodeId, DecisionOutcome.FAIL, 0.0, threshold, reason, null,
            "calibration error: " + message,
            List.of(new Recommendation(1, null, reason, "Fix calibration errors before retrying")), null);
    }

    @JsonIgnore
    public boolean isEvaluated() {
        return outcome != DecisionOutcome.SKIPPED;
    }
}
