package com.calibrationplatform.common.decision;

import com.calibrationplatform.common.model.CanonicalLayer;

import java.util.List;

/**
 * Fixed failure taxonomy. Each reason carries its remediation actions, most useful first.
 */
public enum FailureReason {

    BASE_LAYER_LOW(List.of(
        "Improve code quality: add tests, documentation and type contracts",
        "Review the theoretical foundation of the method",
        "Consider refactoring for maintainability")),
    CHAIN_LAYER_FAIL(List.of(
        "Verify all required inputs are available in the execution graph",
        "Check the method signature for the correct input specification",
        "Ensure upstream methods are executing correctly")),
    UNIT_LAYER_FAIL(List.of(
        "Improve input document structure quality",
        "Ensure all mandatory sections are present",
        "Validate indicator and PPI matrix quality")),
    CONGRUENCE_FAIL(List.of(
        "Review the method ensemble for semantic compatibility",
        "Check the method registry for correct concept tags",
        "Consider a different fusion rule")),
    CONTEXTUAL_FAIL(List.of(
        "Verify the method is appropriate for this question, dimension and policy area",
        "Check the compatibility declaration for correct mappings",
        "Consider a different method for this context")),
    META_LAYER_FAIL(List.of(
        "Improve traceability: export formulas and add structured logging",
        "Validate governance compliance",
        "Optimize execution time if performance is an issue")),
    SCORE_BELOW_THRESHOLD(List.of(
        "Review all layer scores to identify specific improvement areas"));

    private final List<String> actions;

    FailureReason(List<String> actions) {
        this.actions = actions;
    }

    public List<String> actions() {
        return actions;
    }

    public static FailureReason forLayer(CanonicalLayer layer) {
        return switch (layer) {
            case BASE -> BASE_LAYER_LOW;
            case CHAIN -> CHAIN_LAYER_FAIL;
            case UNIT -> UNIT_LAYER_FAIL;
            case QUESTION, DIMENSION, POLICY -> CONTEXTUAL_FAIL;
            case CONGRUENCE -> CONGRUENCE_FAIL;
            case META -> META_LAYER_FAIL;
        };
    }
}
