package com.calibrationplatform.common.layer;

import com.calibrationplatform.common.config.LayerRubric.BaseRubric;
import com.calibrationplatform.common.model.CanonicalLayer;
import com.calibrationplatform.common.model.IntrinsicScore;
import com.calibrationplatform.common.model.LayerScore;
import com.calibrationplatform.common.registry.IntrinsicScoreRegistry;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Intrinsic quality {@code @b}, read from the intrinsic-score registry.
 *
 * <pre>
 *   computed → w_th·b_theory + w_imp·b_impl + w_dep·b_deploy
 *   pending  → pending_score for every component
 *   none     → none_score for every component (warning in rationale)
 *   excluded → not scored; the caller must skip the subject
 * </pre>
 */
public class BaseLayerEvaluator implements LayerEvaluator {

    private final BaseRubric rubric;
    private final IntrinsicScoreRegistry registry;

    public BaseLayerEvaluator(BaseRubric rubric, IntrinsicScoreRegistry registry) {
        this.rubric = rubric;
        this.registry = registry;
    }

    @Override
    public CanonicalLayer layer() {
        return CanonicalLayer.BASE;
    }

    @Override
    public LayerScore evaluate(LayerInput input) {
        String methodId = input.subject().methodId();
        IntrinsicScore intrinsic = registry.getIntrinsic(methodId);

        double theory;
        double impl;
        double deploy;
        String rationale;
        switch (intrinsic.status()) {
            case COMPUTED -> {
                theory = intrinsic.bTheory();
                impl = intrinsic.bImpl();
                deploy = intrinsic.bDeploy();
                rationale = "intrinsic scores from registry";
            }
            case PENDING -> {
                theory = impl = deploy = rubric.pendingScore();
                rationale = "intrinsic calibration pending; fallback " + rubric.pendingScore();
            }
            case NONE -> {
                theory = impl = deploy = rubric.noneScore();
                rationale = "WARNING: no intrinsic calibration for " + methodId
                    + "; fallback " + rubric.noneScore();
            }
            case EXCLUDED -> throw new IllegalStateException(
                "method " + methodId + " is excluded from calibration and must be skipped");
            default -> throw new IllegalStateException("unhandled status " + intrinsic.status());
        }

        double score = rubric.theoryWeight() * theory
                     + rubric.implWeight() * impl
                     + rubric.deployWeight() * deploy;

        Map<String, Double> components = new LinkedHashMap<>();
        components.put("b_theory", theory);
        components.put("b_impl", impl);
        components.put("b_deploy", deploy);

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("registry_status", intrinsic.status().key());

        String formula = String.format("%s·%.4f + %s·%.4f + %s·%.4f",
            rubric.theoryWeight(), theory, rubric.implWeight(), impl, rubric.deployWeight(), deploy);
        return new LayerScore(CanonicalLayer.BASE, clampRounding(score), components, evidence, formula, rationale);
    }

    /** Component weights sum to 1 within tolerance, so only rounding can leave [0,1]. */
    private static double clampRounding(double score) {
        return Math.max(0.0, Math.min(1.0, score));
    }
}
