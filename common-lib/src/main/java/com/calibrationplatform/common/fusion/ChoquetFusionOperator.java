package com.calibrationplatform.common.fusion;

import com.calibrationplatform.common.exception.CalibrationConfigException;
import com.calibrationplatform.common.model.CanonicalLayer;
import com.calibrationplatform.common.model.InteractionTerm;
import com.calibrationplatform.common.model.LayerScore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 2-additive Choquet integral over the active layers.
 *
 * <h3>Formula</h3>
 * <pre>
 *   Cal(I) = Σ_{l ∈ L(M)} a_l·x_l  +  Σ_{(l,k) ∈ L(M)²} a_lk·min(x_l, x_k)
 * </pre>
 *
 * <ol>
 *   <li>Linear terms are summed in canonical layer order over active layers only.</li>
 *   <li>An interaction term is included only when both of its layers are active.</li>
 *   <li>Products and sums are carried exactly and rounded once, so the result does not
 *       depend on summation order.</li>
 *   <li>A final score outside [0,1] means the weights are wrong; it raises
 *       {@link CalibrationConfigException} naming them. The score is never clamped.</li>
 * </ol>
 *
 * <p>With non-negative weights summing to 1 and inputs in [0,1] the result is bounded
 * and monotone non-decreasing in every input.
 *
 * <p>This class is stateless and thread-safe.
 */
public class ChoquetFusionOperator implements FusionOperator {

    @Override
    public FusionResult fuse(Map<CanonicalLayer, LayerScore> activeScores, FusionConfiguration config) {
        List<FusionTerm> linearTerms = new ArrayList<>();
        for (CanonicalLayer layer : CanonicalLayer.values()) {
            LayerScore score = activeScores.get(layer);
            if (score == null) continue;
            linearTerms.add(FusionTerm.linear(layer, config.linearWeight(layer), score.value()));
        }

        List<FusionTerm> interactionTerms = new ArrayList<>();
        for (InteractionTerm it : config.interactions()) {
            LayerScore a = activeScores.get(it.layerA());
            LayerScore b = activeScores.get(it.layerB());
            if (a == null || b == null) continue;
            interactionTerms.add(FusionTerm.interaction(it.key(), it.layerA(), it.layerB(),
                it.weight(), Math.min(a.value(), b.value())));
        }

        List<FusionTerm> terms = new ArrayList<>(linearTerms);
        terms.addAll(interactionTerms);
        double finalScore = FusionResult.exactSum(terms);
        if (!FusionResult.isBounded(finalScore)) {
            throw new CalibrationConfigException("fusion." + config.role().key(), String.format(
                "fused score %.9f outside [0,1]; offending weights linear=%s interactions=%s",
                finalScore, config.linearWeights(), FusionConfiguration.describe(config.interactions())));
        }
        return new FusionResult(FusionResult.exactSum(linearTerms), FusionResult.exactSum(interactionTerms),
            finalScore, terms);
    }
}
