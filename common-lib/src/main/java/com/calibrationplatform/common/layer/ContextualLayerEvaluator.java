package com.calibrationplatform.common.layer;

import com.calibrationplatform.common.config.LayerRubric.ContextualRubric;
import com.calibrationplatform.common.exception.EvidenceException;
import com.calibrationplatform.common.model.CanonicalLayer;
import com.calibrationplatform.common.model.CompatibilityTier;
import com.calibrationplatform.common.model.ExecutionContext;
import com.calibrationplatform.common.model.LayerScore;
import com.calibrationplatform.common.registry.CompatibilityDeclaration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Compatibility of the method with one context axis: {@code @q}, {@code @d} or {@code @p}.
 * An undeclared method resolves every key to {@link CompatibilityTier#UNDECLARED}.
 */
public class ContextualLayerEvaluator implements LayerEvaluator {

    private final CanonicalLayer axis;
    private final ContextualRubric rubric;

    public ContextualLayerEvaluator(CanonicalLayer axis, ContextualRubric rubric) {
        if (!axis.isContextual()) {
            throw new IllegalArgumentException("Not a contextual layer: " + axis.symbol());
        }
        this.axis = axis;
        this.rubric = rubric;
    }

    @Override
    public CanonicalLayer layer() {
        return axis;
    }

    @Override
    public LayerScore evaluate(LayerInput input) {
        String key = contextKey(input.subject().context());
        if (key == null || key.isBlank()) {
            throw new EvidenceException(axis, keyName());
        }
        CompatibilityDeclaration declared = input.declaration() == null
            ? CompatibilityDeclaration.none()
            : input.declaration().compatibility();
        CompatibilityTier tier = declared.tierFor(axis, key);
        double score = rubric.score(tier);

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put(keyName(), key);
        evidence.put("tier", tier.name());
        return new LayerScore(axis, score, Map.of("tier_score", score), evidence,
            "tier(" + tier.name().toLowerCase() + ")",
            keyName() + "=" + key + " declared " + tier.name().toLowerCase());
    }

    /** Same compatibility lookup, used at load time by the anti-universality scan. */
    public double scoreFor(CompatibilityDeclaration declared, String key) {
        return rubric.score(declared.tierFor(axis, key));
    }

    private String contextKey(ExecutionContext ctx) {
        return switch (axis) {
            case QUESTION -> ctx.questionId();
            case DIMENSION -> ctx.dimension();
            case POLICY -> ctx.policyArea();
            case BASE, CHAIN, UNIT, CONGRUENCE, META -> throw new IllegalStateException(axis.symbol());
        };
    }

    private String keyName() {
        return switch (axis) {
            case QUESTION -> "question_id";
            case DIMENSION -> "dimension";
            case POLICY -> "policy_area";
            case BASE, CHAIN, UNIT, CONGRUENCE, META -> throw new IllegalStateException(axis.symbol());
        };
    }
}
