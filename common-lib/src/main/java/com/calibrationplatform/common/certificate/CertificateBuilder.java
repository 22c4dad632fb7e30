package com.calibrationplatform.common.certificate;

import com.calibrationplatform.common.certificate.CalibrationCertificate.AuditTrail;
import com.calibrationplatform.common.certificate.CalibrationCertificate.CertificateContext;
import com.calibrationplatform.common.certificate.CalibrationCertificate.Check;
import com.calibrationplatform.common.certificate.CalibrationCertificate.FusionFormula;
import com.calibrationplatform.common.certificate.CalibrationCertificate.InteractionBreakdown;
import com.calibrationplatform.common.certificate.CalibrationCertificate.LayerBreakdown;
import com.calibrationplatform.common.certificate.CalibrationCertificate.ParameterProvenance;
import com.calibrationplatform.common.certificate.CalibrationCertificate.SensitivityAnalysis;
import com.calibrationplatform.common.certificate.CalibrationCertificate.ValidationChecks;
import com.calibrationplatform.common.digest.ContentHasher;
import com.calibrationplatform.common.evidence.EvidenceBundle;
import com.calibrationplatform.common.fusion.FusionConfiguration;
import com.calibrationplatform.common.fusion.FusionOperator;
import com.calibrationplatform.common.fusion.FusionResult;
import com.calibrationplatform.common.fusion.FusionTerm;
import com.calibrationplatform.common.model.CalibrationSubject;
import com.calibrationplatform.common.model.CanonicalLayer;
import com.calibrationplatform.common.model.ExecutionContext;
import com.calibrationplatform.common.model.InteractionTerm;
import com.calibrationplatform.common.model.LayerScore;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Assembles a {@link CalibrationCertificate} from a finished fusion run.
 *
 * <p>Deterministic apart from the audit timestamp, which is read from the injected
 * {@link Clock}. With a fixed clock, identical inputs give byte-identical certificates.
 *
 * <p>This class is stateless and thread-safe.
 */
public class CertificateBuilder {

    static final String SYMBOLIC_FORMULA = "Cal(I) = Σ a_l·x_l + Σ a_lk·min(x_l, x_k)";

    private final FusionOperator fusionOperator;
    private final Clock clock;
    private final String validatorVersion;

    public CertificateBuilder(FusionOperator fusionOperator, Clock clock, String validatorVersion) {
        this.fusionOperator = fusionOperator;
        this.clock = clock;
        this.validatorVersion = validatorVersion;
    }

    /**
     * @param scores         scores of the active layers, fail-closed entries included
     * @param requiredLayers layers the subject's role requires
     * @param result         output of fusing {@code scores} with {@code fusion}
     */
    public CalibrationCertificate build(CalibrationSubject subject,
                                        EvidenceBundle evidence,
                                        Map<CanonicalLayer, LayerScore> scores,
                                        Set<CanonicalLayer> requiredLayers,
                                        FusionConfiguration fusion,
                                        FusionResult result,
                                        String configHash) {
        ExecutionContext ctx = subject.context();
        CertificateContext context = new CertificateContext(
            ctx.questionId(), ctx.dimension(), ctx.policyArea(), ctx.unitQuality());

        CalibrationCertificate certificate = new CalibrationCertificate(
            instanceId(subject, configHash),
            subject.methodId(),
            subject.nodeId(),
            subject.role().key(),
            context,
            result.finalScore(),
            result.linearSum(),
            result.interactionSum(),
            layerBreakdown(scores),
            interactionBreakdown(result, fusion),
            fusionFormula(result),
            provenance(scores, result, fusion),
            validationChecks(scores, requiredLayers, fusion, result),
            sensitivity(scores, fusion, result),
            new AuditTrail(Instant.now(clock).toString(), configHash, graphHash(subject, evidence), validatorVersion),
            null);
        return certificate.withDigest(digest(certificate));
    }

    static String digest(CalibrationCertificate certificate) {
        return ContentHasher.sha256(certificate.digestView());
    }

    // ── identity ──────────────────────────────────────────────────────────

    private static String instanceId(CalibrationSubject subject, String configHash) {
        String seed = subject.methodId() + '|' + subject.nodeId() + '|'
            + ContentHasher.canonicalJson(subject.context()) + '|' + configHash;
        return UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private static String graphHash(CalibrationSubject subject, EvidenceBundle evidence) {
        Map<String, Object> graph = new LinkedHashMap<>();
        graph.put("node", subject.nodeId());
        graph.put("method", subject.methodId());
        graph.put("interplay", subject.interplay());
        graph.put("chain", evidence.chain());
        return ContentHasher.sha256(graph);
    }

    // ── breakdowns ────────────────────────────────────────────────────────

    private static Map<String, LayerBreakdown> layerBreakdown(Map<CanonicalLayer, LayerScore> scores) {
        Map<String, LayerBreakdown> out = new LinkedHashMap<>();
        for (CanonicalLayer layer : CanonicalLayer.values()) {
            LayerScore s = scores.get(layer);
            if (s == null) continue;
            out.put(layer.symbol(), new LayerBreakdown(s.value(), s.components(), s.evidence(),
                s.formula(), s.rationale()));
        }
        return out;
    }

    private static Map<String, InteractionBreakdown> interactionBreakdown(FusionResult result,
                                                                         FusionConfiguration fusion) {
        Map<String, String> rationales = fusion.interactions().stream()
            .collect(Collectors.toMap(InteractionTerm::key, t -> t.rationale() == null ? "" : t.rationale()));
        Map<String, InteractionBreakdown> out = new LinkedHashMap<>();
        for (FusionTerm t : result.interactionTerms()) {
            CanonicalLayer a = t.layers().get(0);
            CanonicalLayer b = t.layers().get(1);
            String formula = String.format("%.6f·min(x_%s, x_%s) = %.6f·%.6f",
                t.weight(), a.symbol(), b.symbol(), t.weight(), t.input());
            String interpretation = rationales.getOrDefault(t.key(), "");
            out.put(t.key(), new InteractionBreakdown(t.contribution(), t.weight(), formula,
                interpretation + (interpretation.isEmpty() ? "" : "; ") + "bounded by min = " + t.input()));
        }
        return out;
    }

    private static FusionFormula fusionFormula(FusionResult result) {
        List<String> trace = new ArrayList<>();
        List<String> expanded = new ArrayList<>();
        for (FusionTerm t : result.terms()) {
            trace.add(t.trace());
            expanded.add(t.kind() == FusionTerm.Kind.LINEAR
                ? String.format("%.6f·%.6f", t.weight(), t.input())
                : String.format("%.6f·min%s", t.weight(), t.key()));
        }
        trace.add(String.format("linear = %.9f", result.linearSum()));
        trace.add(String.format("interaction = %.9f", result.interactionSum()));
        trace.add(String.format("final = %.9f", result.finalScore()));
        return new FusionFormula(SYMBOLIC_FORMULA, String.join(" + ", expanded), trace, result.terms());
    }

    private static Map<String, ParameterProvenance> provenance(Map<CanonicalLayer, LayerScore> scores,
                                                               FusionResult result,
                                                               FusionConfiguration fusion) {
        Map<String, ParameterProvenance> out = new LinkedHashMap<>();
        for (FusionTerm t : result.terms()) {
            out.put("a_" + t.key(), new ParameterProvenance(t.weight(), fusion.source(), fusion.version()));
        }
        LayerScore base = scores.get(CanonicalLayer.BASE);
        if (base != null && base.evidence().containsKey("registry_status")) {
            Object status = base.evidence().get("registry_status");
            if (!"computed".equals(status)) {
                out.put("base_fallback", new ParameterProvenance(base.value(),
                    "rubric.base." + status + "_score", fusion.version()));
            }
        }
        return out;
    }

    // ── checks ────────────────────────────────────────────────────────────

    private static ValidationChecks validationChecks(Map<CanonicalLayer, LayerScore> scores,
                                                     Set<CanonicalLayer> requiredLayers,
                                                     FusionConfiguration fusion,
                                                     FusionResult result) {
        double f = result.finalScore();
        boolean bounded = FusionResult.isBounded(f)
            && scores.values().stream().allMatch(s -> FusionResult.isBounded(s.value()));
        Check boundedness = new Check(bounded, String.format("final=%.9f in [0,1]", f));

        double total = fusion.totalWeight();
        boolean normalized = FusionConfiguration.isNormalized(total);
        Check normalization = new Check(normalized, String.format("Σ weights = %.9f", total));

        List<String> problems = new ArrayList<>();
        for (CanonicalLayer layer : requiredLayers) {
            if (!scores.containsKey(layer)) problems.add(layer.symbol() + " not evaluated");
        }
        for (CanonicalLayer layer : CanonicalLayer.values()) {
            LayerScore s = scores.get(layer);
            if (s != null && s.isFailClosed()) problems.add(layer.symbol() + " " + s.rationale());
        }
        Check completeness = new Check(problems.isEmpty(),
            problems.isEmpty() ? "all required layers evaluated" : String.join("; ", problems));
        return new ValidationChecks(boundedness, normalization, completeness);
    }

    // ── sensitivity ───────────────────────────────────────────────────────

    private SensitivityAnalysis sensitivity(Map<CanonicalLayer, LayerScore> scores,
                                            FusionConfiguration fusion,
                                            FusionResult result) {
        Map<String, Double> layerHeadroom = new LinkedHashMap<>();
        String topLayer = null;
        double topLayerGain = 0.0;
        for (CanonicalLayer layer : CanonicalLayer.values()) {
            LayerScore s = scores.get(layer);
            if (s == null) continue;
            Map<CanonicalLayer, LayerScore> raised = new EnumMap<>(scores);
            raised.put(layer, LayerScore.of(layer, 1.0, "1.0", "what-if"));
            double gain = fusionOperator.fuse(raised, fusion).finalScore() - result.finalScore();
            layerHeadroom.put(layer.symbol(), gain);
            if (gain > topLayerGain) {
                topLayerGain = gain;
                topLayer = layer.symbol();
            }
        }

        Map<String, Double> interactionHeadroom = new LinkedHashMap<>();
        String topInteraction = null;
        double topInteractionGain = 0.0;
        for (FusionTerm t : result.interactionTerms()) {
            double gain = t.weight() * (1.0 - t.input());
            interactionHeadroom.put(t.key(), gain);
            if (gain > topInteractionGain) {
                topInteractionGain = gain;
                topInteraction = t.key();
            }
        }
        return new SensitivityAnalysis(topLayer, topInteraction, layerHeadroom, interactionHeadroom);
    }
}
