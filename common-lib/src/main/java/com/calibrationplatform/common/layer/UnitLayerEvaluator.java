package com.calibrationplatform.common.layer;

import com.calibrationplatform.common.config.LayerRubric.UnitFunction;
import com.calibrationplatform.common.config.LayerRubric.UnitRubric;
import com.calibrationplatform.common.evidence.UnitEvidence;
import com.calibrationplatform.common.model.CanonicalLayer;
import com.calibrationplatform.common.model.LayerScore;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Input-document quality {@code @u = g_role(U)}.
 *
 * <p>Hard gates are checked first, in this order, and each forces exactly {@code 0.0}:
 * structural compliance below the minimum, PPI matrix absent, indicator matrix absent.
 */
public class UnitLayerEvaluator implements LayerEvaluator {

    private final UnitRubric rubric;

    public UnitLayerEvaluator(UnitRubric rubric) {
        this.rubric = rubric;
    }

    @Override
    public CanonicalLayer layer() {
        return CanonicalLayer.UNIT;
    }

    @Override
    public LayerScore evaluate(LayerInput input) {
        UnitEvidence unit = input.evidence().requireUnit();
        double u = input.subject().context().unitQuality();

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("unit_quality", u);
        evidence.put("structural_compliance", unit.structuralCompliance());
        evidence.put("indicator_matrix_present", unit.indicatorMatrixPresent());
        evidence.put("ppi_matrix_present", unit.ppiMatrixPresent());

        String gate = hardGate(unit);
        if (gate != null) {
            return new LayerScore(CanonicalLayer.UNIT, 0.0, Map.of("U", u), evidence,
                "hard_gate", "HARD GATE: " + gate);
        }

        UnitFunction g = rubric.functionFor(input.subject().role());
        double score = g.apply(u);

        Map<String, Double> components = new LinkedHashMap<>();
        components.put("U", u);
        components.put("S", unit.structuralCompliance());
        components.put("g", score);
        return new LayerScore(CanonicalLayer.UNIT, score, components, evidence, g.formula(),
            String.format("%s response for role %s at U=%.4f",
                g.kind().name().toLowerCase(), input.subject().role().key(), u));
    }

    private String hardGate(UnitEvidence unit) {
        if (unit.structuralCompliance() < rubric.minStructuralCompliance()) {
            return String.format("S=%.4f < %s", unit.structuralCompliance(), rubric.minStructuralCompliance());
        }
        if (rubric.requirePpiPresence() && !unit.ppiMatrixPresent()) {
            return "PPI matrix absent";
        }
        if (rubric.requireIndicatorMatrix() && !unit.indicatorMatrixPresent()) {
            return "indicator matrix absent";
        }
        return null;
    }
}
