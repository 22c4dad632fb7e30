package com.calibrationplatform.common.layer;

import com.calibrationplatform.common.config.LayerRubric;
import com.calibrationplatform.common.model.CanonicalLayer;
import com.calibrationplatform.common.model.LayerScore;
import com.calibrationplatform.common.registry.IntrinsicScoreRegistry;
import com.calibrationplatform.common.registry.MethodRegistry;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * One evaluator per canonical layer, built once from the loaded rubric.
 * Adding a layer constant without an evaluator fails to compile here.
 */
public final class LayerScoreCatalog {

    private final Map<CanonicalLayer, LayerEvaluator> evaluators;

    public LayerScoreCatalog(LayerRubric rubric, IntrinsicScoreRegistry intrinsic, MethodRegistry methods) {
        EnumMap<CanonicalLayer, LayerEvaluator> map = new EnumMap<>(CanonicalLayer.class);
        for (CanonicalLayer layer : CanonicalLayer.values()) {
            map.put(layer, create(layer, rubric, intrinsic, methods));
        }
        this.evaluators = Collections.unmodifiableMap(map);
    }

    private static LayerEvaluator create(CanonicalLayer layer, LayerRubric rubric,
                                         IntrinsicScoreRegistry intrinsic, MethodRegistry methods) {
        return switch (layer) {
            case BASE -> new BaseLayerEvaluator(rubric.base(), intrinsic);
            case CHAIN -> new ChainLayerEvaluator(rubric.chain());
            case UNIT -> new UnitLayerEvaluator(rubric.unit());
            case QUESTION, DIMENSION, POLICY -> new ContextualLayerEvaluator(layer, rubric.contextual());
            case CONGRUENCE -> new CongruenceLayerEvaluator(rubric.congruence(), methods);
            case META -> new MetaLayerEvaluator(rubric.meta());
        };
    }

    public LayerScore evaluate(CanonicalLayer layer, LayerInput input) {
        return evaluators.get(layer).evaluate(input);
    }
}
