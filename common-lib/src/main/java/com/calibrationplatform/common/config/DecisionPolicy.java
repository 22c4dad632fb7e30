package com.calibrationplatform.common.config;

import com.calibrationplatform.common.exception.CalibrationConfigException;
import com.calibrationplatform.common.model.MethodRole;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Thresholds used by the validation decision layer and the plan aggregator.
 *
 * @param defaultThreshold     threshold when neither the method nor its role overrides it
 * @param roleThresholds       per-role pass thresholds
 * @param conditionalTolerance width of the CONDITIONAL_PASS band below the threshold
 * @param attributionFloor     a layer whose normalized contribution is below this is blamed on FAIL
 * @param planPassRatio        plan is CONDITIONAL_PASS when passed ≥ ratio·evaluated
 */
public record DecisionPolicy(
    @JsonProperty("default_threshold")     double defaultThreshold,
    @JsonProperty("role_thresholds")       Map<MethodRole, Double> roleThresholds,
    @JsonProperty("conditional_tolerance") double conditionalTolerance,
    @JsonProperty("attribution_floor")     double attributionFloor,
    @JsonProperty("plan_pass_ratio")       double planPassRatio
) {
    public DecisionPolicy {
        LayerRubric.requireUnit("decision", "default_threshold", defaultThreshold);
        LayerRubric.requireUnit("decision", "conditional_tolerance", conditionalTolerance);
        LayerRubric.requireUnit("decision", "attribution_floor", attributionFloor);
        LayerRubric.requireUnit("decision", "plan_pass_ratio", planPassRatio);
        EnumMap<MethodRole, Double> copy = new EnumMap<>(MethodRole.class);
        if (roleThresholds != null) {
            roleThresholds.forEach((role, t) -> {
                LayerRubric.requireUnit("decision", "threshold." + role.key(), t);
                copy.put(role, t);
            });
        }
        roleThresholds = Collections.unmodifiableMap(copy);
    }

    public static DecisionPolicy defaults() {
        Map<MethodRole, Double> thresholds = new EnumMap<>(MethodRole.class);
        thresholds.put(MethodRole.ANALYZER, 0.7);
        thresholds.put(MethodRole.AGGREGATE, 0.65);
        return new DecisionPolicy(0.6, thresholds, 0.05, 0.5, 0.8);
    }

    public double thresholdFor(MethodRole role) {
        return roleThresholds.getOrDefault(role, defaultThreshold);
    }

    /** Method override wins over the role threshold. */
    public double thresholdFor(MethodRole role, Double methodOverride) {
        if (methodOverride != null) {
            if (methodOverride < 0.0 || methodOverride > 1.0) {
                throw new CalibrationConfigException("decision", "method threshold out of [0,1]: " + methodOverride);
            }
            return methodOverride;
        }
        return thresholdFor(role);
    }
}
