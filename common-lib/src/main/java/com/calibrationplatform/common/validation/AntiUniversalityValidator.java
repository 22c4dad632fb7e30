package com.calibrationplatform.common.validation;

import com.calibrationplatform.common.config.ContextDomain;
import com.calibrationplatform.common.config.LayerRubric.ContextualRubric;
import com.calibrationplatform.common.exception.CalibrationConfigException;
import com.calibrationplatform.common.layer.ContextualLayerEvaluator;
import com.calibrationplatform.common.model.CanonicalLayer;
import com.calibrationplatform.common.registry.MethodDeclaration;
import com.calibrationplatform.common.registry.MethodRegistry;

import java.util.ArrayList;
import java.util.List;

/**
 * Rejects configurations in which a method claims to be near-perfect everywhere.
 *
 * <p>A method is universal when its <em>lowest</em> {@code @q}, {@code @d} and {@code @p}
 * scores across the whole domain are all at or above the threshold. Because the three
 * axes are scored independently, the minimum per axis equals the minimum over every
 * (question, dimension, policy) combination.
 *
 * <p>An axis with no entries in the domain cannot be scanned and is treated as not
 * universal.
 */
public final class AntiUniversalityValidator {

    public static final double DEFAULT_THRESHOLD = 0.9;

    private final double threshold;
    private final ContextualLayerEvaluator questions;
    private final ContextualLayerEvaluator dimensions;
    private final ContextualLayerEvaluator policies;

    public AntiUniversalityValidator(ContextualRubric rubric, double threshold) {
        if (threshold <= 0.0 || threshold > 1.0) {
            throw new CalibrationConfigException("anti_universality",
                "threshold must be in (0,1], got " + threshold);
        }
        this.threshold = threshold;
        this.questions = new ContextualLayerEvaluator(CanonicalLayer.QUESTION, rubric);
        this.dimensions = new ContextualLayerEvaluator(CanonicalLayer.DIMENSION, rubric);
        this.policies = new ContextualLayerEvaluator(CanonicalLayer.POLICY, rubric);
    }

    /** @return ids of universal methods, in registry order */
    public List<String> findViolations(MethodRegistry registry, ContextDomain domain) {
        List<String> violators = new ArrayList<>();
        for (MethodDeclaration m : registry.all()) {
            if (isUniversal(m, domain)) violators.add(m.methodId());
        }
        return violators;
    }

    /**
     * @throws CalibrationConfigException naming every universal method
     */
    public void validate(MethodRegistry registry, ContextDomain domain) {
        List<String> violators = findViolations(registry, domain);
        if (!violators.isEmpty()) {
            throw new CalibrationConfigException("anti_universality", String.format(
                "methods score >= %.2f on @q, @d and @p across the whole domain: %s",
                threshold, violators));
        }
    }

    public boolean isUniversal(MethodDeclaration method, ContextDomain domain) {
        return minimum(questions, method, domain.questions()) >= threshold
            && minimum(dimensions, method, domain.dimensions()) >= threshold
            && minimum(policies, method, domain.policyAreas()) >= threshold;
    }

    private static double minimum(ContextualLayerEvaluator axis, MethodDeclaration method, List<String> keys) {
        if (keys.isEmpty()) return Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        for (String key : keys) {
            min = Math.min(min, axis.scoreFor(method.compatibility(), key));
        }
        return min;
    }

    public double threshold() {
        return threshold;
    }
}
