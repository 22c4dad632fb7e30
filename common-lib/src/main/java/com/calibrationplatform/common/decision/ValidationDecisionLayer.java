package com.calibrationplatform.common.decision;

import com.calibrationplatform.common.certificate.CalibrationCertificate;
import com.calibrationplatform.common.certificate.CalibrationCertificate.LayerBreakdown;
import com.calibrationplatform.common.certificate.CalibrationCertificate.ValidationChecks;
import com.calibrationplatform.common.config.DecisionPolicy;
import com.calibrationplatform.common.fusion.FusionTerm;
import com.calibrationplatform.common.model.CanonicalLayer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Turns a certificate into PASS / CONDITIONAL_PASS / FAIL.
 *
 * <h3>Rules, first match wins</h3>
 * <pre>
 *   completeness check failed          → FAIL, blamed on the first fail-closed layer
 *   boundedness or normalization failed → FAIL, SCORE_BELOW_THRESHOLD, no layer
 *   score ≥ threshold                  → PASS
 *   score ≥ threshold − tolerance      → CONDITIONAL_PASS
 *   otherwise                          → FAIL, blamed on the weakest layer below the floor
 * </pre>
 *
 * <h3>Normalized contribution</h3>
 * <pre>
 *   n_l = Σ contribution(terms involving l) / Σ weight(terms involving l)
 * </pre>
 * i.e. the weight-averaged input the layer brought to the score; the raw layer score
 * when the layer carries no weight. Ties go to the earlier canonical layer.
 *
 * <p>This class is stateless and thread-safe.
 */
public final class ValidationDecisionLayer {

    private final DecisionPolicy policy;

    public ValidationDecisionLayer(DecisionPolicy policy) {
        this.policy = policy;
    }

    public Decision decide(CalibrationCertificate certificate, double threshold) {
        double score = certificate.calibrationScore();
        List<WeakLayer> weak = weakLayers(certificate);

        if (!certificate.validationChecks().completeness().passed()) {
            CanonicalLayer culprit = firstFailClosed(certificate);
            FailureReason reason = culprit == null
                ? FailureReason.SCORE_BELOW_THRESHOLD
                : FailureReason.forLayer(culprit);
            return new Decision(certificate.method(), certificate.node(), DecisionOutcome.FAIL, score,
                threshold, reason, culprit == null ? null : culprit.symbol(),
                "incomplete evidence: " + certificate.validationChecks().completeness().detail(),
                recommendations(reason, culprit, weak), null);
        }
        ValidationChecks checks = certificate.validationChecks();
        if (!checks.boundedness().passed() || !checks.normalization().passed()) {
            List<String> failed = new ArrayList<>();
            if (!checks.boundedness().passed()) failed.add("boundedness: " + checks.boundedness().detail());
            if (!checks.normalization().passed()) failed.add("normalization: " + checks.normalization().detail());
            return new Decision(certificate.method(), certificate.node(), DecisionOutcome.FAIL, score,
                threshold, FailureReason.SCORE_BELOW_THRESHOLD, null,
                "certificate checks failed: " + String.join("; ", failed),
                recommendations(FailureReason.SCORE_BELOW_THRESHOLD, null, weak), null);
        }
        if (score >= threshold) {
            return new Decision(certificate.method(), certificate.node(), DecisionOutcome.PASS, score,
                threshold, null, null, String.format("score %.4f >= threshold %.4f", score, threshold),
                List.of(), null);
        }
        if (score >= threshold - policy.conditionalTolerance()) {
            return new Decision(certificate.method(), certificate.node(), DecisionOutcome.CONDITIONAL_PASS,
                score, threshold, null, null,
                String.format("score %.4f within %.4f of threshold %.4f", score, policy.conditionalTolerance(), threshold),
                weak.isEmpty()
                    ? recommendations(FailureReason.SCORE_BELOW_THRESHOLD, null, weak)
                    : recommendations(FailureReason.forLayer(weak.get(0).layer()), weak.get(0).layer(), weak),
                null);
        }

        CanonicalLayer culprit = weak.isEmpty() ? null : weak.get(0).layer();
        FailureReason reason = culprit == null ? FailureReason.SCORE_BELOW_THRESHOLD : FailureReason.forLayer(culprit);
        String details = culprit == null
            ? String.format("score %.4f < threshold %.4f; no layer below floor %.2f", score, threshold, policy.attributionFloor())
            : String.format("score %.4f < threshold %.4f; %s normalized contribution %.4f < floor %.2f",
                score, threshold, culprit.symbol(), weak.get(0).normalized(), policy.attributionFloor());
        return new Decision(certificate.method(), certificate.node(), DecisionOutcome.FAIL, score, threshold,
            reason, culprit == null ? null : culprit.symbol(), details, recommendations(reason, culprit, weak), null);
    }

    /** Layers whose normalized contribution is below the floor, weakest first. */
    List<WeakLayer> weakLayers(CalibrationCertificate certificate) {
        List<WeakLayer> out = new ArrayList<>();
        Map<String, LayerBreakdown> layers = certificate.layerBreakdown();
        for (CanonicalLayer layer : CanonicalLayer.values()) {
            LayerBreakdown breakdown = layers.get(layer.symbol());
            if (breakdown == null) continue;
            double n = normalizedContribution(layer, breakdown.score(), certificate.fusionFormula().terms());
            if (n < policy.attributionFloor()) out.add(new WeakLayer(layer, n));
        }
        out.sort(Comparator.comparingDouble(WeakLayer::normalized)
            .thenComparing(w -> w.layer().ordinal()));
        return out;
    }

    static double normalizedContribution(CanonicalLayer layer, double rawScore, List<FusionTerm> terms) {
        double contribution = 0.0;
        double weight = 0.0;
        for (FusionTerm t : terms) {
            if (!t.involves(layer)) continue;
            contribution += t.contribution();
            weight += t.weight();
        }
        return weight > 0.0 ? contribution / weight : rawScore;
    }

    private static CanonicalLayer firstFailClosed(CalibrationCertificate certificate) {
        for (CanonicalLayer layer : CanonicalLayer.values()) {
            LayerBreakdown b = certificate.layerBreakdown().get(layer.symbol());
            if (b != null && b.rationale() != null && b.rationale().startsWith("fail-closed")) return layer;
        }
        return null;
    }

    private static List<Recommendation> recommendations(FailureReason primary, CanonicalLayer primaryLayer,
                                                        List<WeakLayer> weak) {
        List<Recommendation> out = new ArrayList<>();
        String symbol = primaryLayer == null ? null : primaryLayer.symbol();
        for (String action : primary.actions()) {
            out.add(new Recommendation(out.size() + 1, symbol, primary, action));
        }
        for (WeakLayer w : weak) {
            if (w.layer() == primaryLayer) continue;
            FailureReason r = FailureReason.forLayer(w.layer());
            out.add(new Recommendation(out.size() + 1, w.layer().symbol(), r, r.actions().get(0)));
        }
        return out;
    }

    record WeakLayer(CanonicalLayer layer, double normalized) {}
}
