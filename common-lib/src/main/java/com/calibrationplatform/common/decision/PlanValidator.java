package com.calibrationplatform.common.decision;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Aggregates independent per-subject decisions into a plan verdict.
 *
 * <pre>
 *   nothing evaluated                        → SKIPPED
 *   failed = 0 and conditional = 0           → PASS
 *   failed = 0 or passed ≥ ratio·evaluated   → CONDITIONAL_PASS
 *   otherwise                                → FAIL
 *   pass_rate = passed / total
 * </pre>
 * {@code per_method} is sorted by method id then node id, so the report does not
 * depend on the order decisions arrived in.
 */
public final class PlanValidator {

    private static final Comparator<Decision> BY_METHOD_THEN_NODE =
        Comparator.comparing(Decision::methodId).thenComparing(Decision::nodeId);

    private PlanValidator() {}

    public static PlanValidationReport aggregate(String planId, List<Decision> decisions, double passRatio) {
        int passed = 0;
        int failed = 0;
        int conditional = 0;
        int skipped = 0;
        for (Decision d : decisions) {
            switch (d.outcome()) {
                case PASS -> passed++;
                case FAIL -> failed++;
                case CONDITIONAL_PASS -> conditional++;
                case SKIPPED -> skipped++;
            }
        }
        int total = decisions.size();
        int evaluated = (int) decisions.stream().filter(Decision::isEvaluated).count();

        DecisionOutcome overall;
        if (evaluated == 0) {
            overall = DecisionOutcome.SKIPPED;
        } else if (failed == 0 && conditional == 0) {
            overall = DecisionOutcome.PASS;
        } else if (failed == 0 || passed >= passRatio * evaluated) {
            overall = DecisionOutcome.CONDITIONAL_PASS;
        } else {
            overall = DecisionOutcome.FAIL;
        }

        List<Decision> sorted = new ArrayList<>(decisions);
        sorted.sort(BY_METHOD_THEN_NODE);
        double passRate = total == 0 ? 0.0 : (double) passed / total;
        return new PlanValidationReport(planId, overall, passRate, passed, failed, conditional,
            skipped, total, sorted);
    }
}
