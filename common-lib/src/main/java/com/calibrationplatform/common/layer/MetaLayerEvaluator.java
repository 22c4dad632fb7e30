package com.calibrationplatform.common.layer;

import com.calibrationplatform.common.config.LayerRubric.MetaRubric;
import com.calibrationplatform.common.evidence.MetaEvidence;
import com.calibrationplatform.common.model.CanonicalLayer;
import com.calibrationplatform.common.model.LayerScore;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Governance and observability {@code @m}.
 *
 * <pre>
 *   @m = w_transp·m_transp + w_gov·m_gov + w_cost·m_cost
 *   m_transp = tier[#{formula exported, trace complete, logs conformant}]
 *   m_gov    = tier[#{version tagged, config hash matches, signature valid}]
 *   m_cost   = min(runtime tier, memory tier)
 * </pre>
 */
public class MetaLayerEvaluator implements LayerEvaluator {

    private final MetaRubric rubric;

    public MetaLayerEvaluator(MetaRubric rubric) {
        this.rubric = rubric;
    }

    @Override
    public CanonicalLayer layer() {
        return CanonicalLayer.META;
    }

    @Override
    public LayerScore evaluate(LayerInput input) {
        MetaEvidence meta = input.evidence().requireMeta();

        double transparency = rubric.transparencyTiers().get(meta.transparencyFlags());
        double governance = rubric.governanceTiers().get(meta.governanceFlags());
        double cost = Math.min(rubric.runtimeTier(meta.runtimeMs()), rubric.memoryTier(meta.memoryMb()));

        double score = rubric.transparencyWeight() * transparency
                     + rubric.governanceWeight() * governance
                     + rubric.costWeight() * cost;
        score = Math.max(0.0, Math.min(1.0, score));

        Map<String, Double> components = new LinkedHashMap<>();
        components.put("m_transp", transparency);
        components.put("m_gov", governance);
        components.put("m_cost", cost);

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("transparency_flags", meta.transparencyFlags());
        evidence.put("governance_flags", meta.governanceFlags());
        evidence.put("runtime_ms", meta.runtimeMs());
        evidence.put("memory_mb", meta.memoryMb());

        String formula = String.format("%s·%.4f + %s·%.4f + %s·%.4f",
            rubric.transparencyWeight(), transparency,
            rubric.governanceWeight(), governance,
            rubric.costWeight(), cost);
        return new LayerScore(CanonicalLayer.META, score, components, evidence, formula,
            String.format("transparency %d/3, governance %d/3", meta.transparencyFlags(), meta.governanceFlags()));
    }
}
