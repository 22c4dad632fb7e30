package com.calibrationplatform.common.decision;

public enum DecisionOutcome {
    PASS,
    FAIL,
    CONDITIONAL_PASS,
    SKIPPED
}
