package com.calibrationplatform.common.layer;

import com.calibrationplatform.common.config.LayerRubric.ChainRubric;
import com.calibrationplatform.common.evidence.ChainEvidence;
import com.calibrationplatform.common.model.CanonicalLayer;
import com.calibrationplatform.common.model.LayerScore;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Wiring soundness {@code @chain}. Tiers are checked in priority order and the
 * first match wins:
 * <ol>
 *   <li>required input absent or type-incompatible → hard mismatch</li>
 *   <li>beneficial input absent</li>
 *   <li>non-fatal schema deviation</li>
 *   <li>all contracts pass, warnings present</li>
 *   <li>all contracts pass, no warnings</li>
 * </ol>
 */
public class ChainLayerEvaluator implements LayerEvaluator {

    private final ChainRubric rubric;

    public ChainLayerEvaluator(ChainRubric rubric) {
        this.rubric = rubric;
    }

    @Override
    public CanonicalLayer layer() {
        return CanonicalLayer.CHAIN;
    }

    @Override
    public LayerScore evaluate(LayerInput input) {
        ChainEvidence chain = input.evidence().requireChain();

        Set<String> missingRequired = missing(chain.requiredInputs(), chain.providedInputs());
        Set<String> missingBeneficial = missing(chain.beneficialInputs(), chain.providedInputs());

        double score;
        String tier;
        String rationale;
        if (!missingRequired.isEmpty() || !chain.typeMismatches().isEmpty()) {
            score = rubric.hardMismatch();
            tier = "hard_mismatch";
            rationale = "required inputs missing " + missingRequired
                + " type mismatches " + chain.typeMismatches();
        } else if (!missingBeneficial.isEmpty()) {
            score = rubric.missingBeneficial();
            tier = "missing_beneficial";
            rationale = "beneficial inputs missing " + missingBeneficial;
        } else if (!chain.schemaDeviations().isEmpty()) {
            score = rubric.schemaDeviation();
            tier = "schema_deviation";
            rationale = "schema deviations " + chain.schemaDeviations();
        } else if (!chain.warnings().isEmpty()) {
            score = rubric.passWithWarnings();
            tier = "pass_with_warnings";
            rationale = chain.warnings().size() + " contract warning(s)";
        } else {
            score = rubric.clean();
            tier = "clean";
            rationale = "all contracts pass";
        }

        Map<String, Double> components = new LinkedHashMap<>();
        components.put("missing_required", (double) missingRequired.size());
        components.put("type_mismatches", (double) chain.typeMismatches().size());
        components.put("missing_beneficial", (double) missingBeneficial.size());
        components.put("schema_deviations", (double) chain.schemaDeviations().size());
        components.put("warnings", (double) chain.warnings().size());

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("required_inputs", sorted(chain.requiredInputs()));
        evidence.put("provided_inputs", sorted(chain.providedInputs()));
        evidence.put("tier", tier);

        return new LayerScore(CanonicalLayer.CHAIN, score, components, evidence, "tier(" + tier + ")", rationale);
    }

    private static Set<String> missing(Set<String> wanted, Set<String> provided) {
        Set<String> out = new TreeSet<>(wanted);
        out.removeAll(provided);
        return out;
    }

    private static List<String> sorted(Set<String> values) {
        return List.copyOf(new TreeSet<>(values));
    }
}
