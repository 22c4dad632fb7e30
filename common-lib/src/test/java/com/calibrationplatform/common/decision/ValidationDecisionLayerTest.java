package com.calibrationplatform.common.decision;

import com.calibrationplatform.common.CalibrationFixtures;
import com.calibrationplatform.common.certificate.CalibrationCertificate;
import com.calibrationplatform.common.certificate.CalibrationCertificate.Check;
import com.calibrationplatform.common.certificate.CalibrationCertificate.ValidationChecks;
import com.calibrationplatform.common.config.DecisionPolicy;
import com.calibrationplatform.common.fusion.FusionTerm;
import com.calibrationplatform.common.model.CanonicalLayer;
import com.calibrationplatform.common.model.LayerScore;
import com.calibrationplatform.common.model.MethodRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static com.calibrationplatform.common.model.CanonicalLayer.*;
import static org.junit.jupiter.api.Assertions.*;

class ValidationDecisionLayerTest {

    private final ValidationDecisionLayer layer = new ValidationDecisionLayer(DecisionPolicy.defaults());

    private static Map<CanonicalLayer, LayerScore> allAt(double value) {
        return new EnumMap<>(CalibrationFixtures.uniform(EnumSet.allOf(CanonicalLayer.class), value));
    }

    private static CalibrationCertificate certificate(Map<CanonicalLayer, LayerScore> scores) {
        return CalibrationFixtures.certificate(scores, CalibrationFixtures.analyzerFusion());
    }

    // ── outcome bands ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("outcome bands")
    class Bands {

        private final CalibrationCertificate scenarioC =
            CalibrationFixtures.certificate(CalibrationFixtures.scenarioCScores(), CalibrationFixtures.scenarioCFusion());

        @Test
        @DisplayName("score ≥ threshold → PASS with no failure reason")
        void pass() {
            Decision d = layer.decide(scenarioC, 0.7);
            assertEquals(DecisionOutcome.PASS, d.outcome());
            assertNull(d.failureReason());
            assertTrue(d.recommendations().isEmpty());
        }

        @Test
        @DisplayName("score within tolerance below threshold → CONDITIONAL_PASS")
        void conditional() {
            Decision d = layer.decide(scenarioC, 0.89);
            assertEquals(DecisionOutcome.CONDITIONAL_PASS, d.outcome());
            assertFalse(d.recommendations().isEmpty());
        }

        @Test
        @DisplayName("below the band with no weak layer → SCORE_BELOW_THRESHOLD")
        void failWithoutWeakLayer() {
            Decision d = layer.decide(scenarioC, 0.95);
            assertEquals(DecisionOutcome.FAIL, d.outcome());
            assertEquals(FailureReason.SCORE_BELOW_THRESHOLD, d.failureReason());
            assertNull(d.failedLayer());
            assertFalse(d.recommendations().isEmpty());
        }

        @Test
        @DisplayName("threshold boundary is inclusive")
        void boundaryInclusive() {
            assertEquals(DecisionOutcome.PASS, layer.decide(scenarioC, scenarioC.calibrationScore()).outcome());
        }
    }

    // ── attribution ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("failure attribution")
    class Attribution {

        @Test
        @DisplayName("broken wiring is blamed on @chain with chain remediation first")
        void chainBlamed() {
            Map<CanonicalLayer, LayerScore> scores = allAt(0.9);
            scores.put(CHAIN, LayerScore.of(CHAIN, 0.0, "tier(hard_mismatch)", "required input missing"));
            Decision d = layer.decide(certificate(scores), 0.7);

            assertEquals(DecisionOutcome.FAIL, d.outcome());
            assertEquals(FailureReason.CHAIN_LAYER_FAIL, d.failureReason());
            assertEquals("@chain", d.failedLayer());
            Recommendation first = d.recommendations().get(0);
            assertEquals(1, first.rank());
            assertEquals("@chain", first.layer());
            assertEquals(FailureReason.CHAIN_LAYER_FAIL.actions().get(0), first.action());
        }

        @Test
        @DisplayName("other weak layers follow the primary recommendations")
        void secondaryRecommendations() {
            Map<CanonicalLayer, LayerScore> scores = allAt(0.9);
            scores.put(CHAIN, LayerScore.of(CHAIN, 0.0, "", ""));
            Decision d = layer.decide(certificate(scores), 0.7);
            List<String> layers = d.recommendations().stream().map(Recommendation::layer).toList();
            assertTrue(layers.contains("@u"), layers.toString());
            assertTrue(layers.contains("@C"), layers.toString());
        }

        @Test
        @DisplayName("ties go to the earlier canonical layer")
        void tieBreak() {
            Map<CanonicalLayer, LayerScore> scores = allAt(1.0);
            scores.put(BASE, LayerScore.of(BASE, 0.0, "", ""));
            scores.put(META, LayerScore.of(META, 0.0, "", ""));
            Decision d = layer.decide(certificate(scores), 0.95);
            assertEquals(FailureReason.BASE_LAYER_LOW, d.failureReason());
            assertEquals("@b", d.failedLayer());
        }

        @Test
        @DisplayName("contextual layers map to CONTEXTUAL_FAIL")
        void contextual() {
            assertEquals(FailureReason.CONTEXTUAL_FAIL, FailureReason.forLayer(QUESTION));
            assertEquals(FailureReason.CONTEXTUAL_FAIL, FailureReason.forLayer(DIMENSION));
            assertEquals(FailureReason.CONTEXTUAL_FAIL, FailureReason.forLayer(POLICY));
        }

        @Test
        @DisplayName("normalized contribution averages over every term involving the layer")
        void normalizedContribution() {
            List<FusionTerm> terms = List.of(
                FusionTerm.linear(UNIT, 0.1, 0.8),
                FusionTerm.interaction("(@u,@chain)", UNIT, CHAIN, 0.3, 0.4));
            assertEquals((0.08 + 0.12) / 0.4, ValidationDecisionLayer.normalizedContribution(UNIT, 0.8, terms), 1e-12);
            assertEquals(0.25, ValidationDecisionLayer.normalizedContribution(META, 0.25, terms));
        }
    }

    // ── fail-closed ───────────────────────────────────────────────────────

    @Test
    @DisplayName("fail-closed layer → FAIL naming that layer, even when the score clears the threshold")
    void failClosedBeatsScore() {
        Map<CanonicalLayer, LayerScore> scores = allAt(1.0);
        scores.put(META, LayerScore.failClosed(META, "signature_valid"));
        CalibrationCertificate c = certificate(scores);
        assertTrue(c.calibrationScore() >= 0.7);

        Decision d = layer.decide(c, 0.7);
        assertEquals(DecisionOutcome.FAIL, d.outcome());
        assertEquals(FailureReason.META_LAYER_FAIL, d.failureReason());
        assertEquals("@m", d.failedLayer());
        assertTrue(d.details().contains("signature_valid"));
    }

    // ── certificate checks ────────────────────────────────────────────────

    private static CalibrationCertificate withChecks(CalibrationCertificate c, ValidationChecks checks) {
        return new CalibrationCertificate(c.instanceId(), c.method(), c.node(), c.role(), c.context(),
            c.calibrationScore(), c.linearScore(), c.interactionScore(), c.layerBreakdown(),
            c.interactionBreakdown(), c.fusionFormula(), c.parameterProvenance(), checks,
            c.sensitivityAnalysis(), c.auditTrail(), c.certificateDigest());
    }

    @Nested
    @DisplayName("failed certificate checks")
    class FailedChecks {

        private final CalibrationCertificate passing = certificate(allAt(1.0));

        @Test
        @DisplayName("failed boundedness → FAIL even when the score clears the threshold")
        void boundedness() {
            ValidationChecks ok = passing.validationChecks();
            CalibrationCertificate c = withChecks(passing, new ValidationChecks(
                new Check(false, "final=1.000000500 in [0,1]"), ok.normalization(), ok.completeness()));

            Decision d = layer.decide(c, 0.7);
            assertEquals(DecisionOutcome.FAIL, d.outcome());
            assertEquals(FailureReason.SCORE_BELOW_THRESHOLD, d.failureReason());
            assertNull(d.failedLayer());
            assertTrue(d.details().contains("boundedness"), d.details());
        }

        @Test
        @DisplayName("failed normalization → FAIL naming the check")
        void normalization() {
            ValidationChecks ok = passing.validationChecks();
            CalibrationCertificate c = withChecks(passing, new ValidationChecks(
                ok.boundedness(), new Check(false, "Σ weights = 1.000000500"), ok.completeness()));

            Decision d = layer.decide(c, 0.7);
            assertEquals(DecisionOutcome.FAIL, d.outcome());
            assertTrue(d.details().contains("normalization"), d.details());
            assertFalse(d.details().contains("boundedness"), d.details());
        }

        @Test
        @DisplayName("all checks passing leaves the score bands in charge")
        void allPassing() {
            assertTrue(passing.validationChecks().allPassed());
            assertEquals(DecisionOutcome.PASS, layer.decide(passing, 0.7).outcome());
        }
    }

    // ── thresholds ────────────────────────────────────────────────────────

    @Test
    @DisplayName("method override, then role threshold, then default")
    void thresholdResolution() {
        DecisionPolicy policy = DecisionPolicy.defaults();
        assertEquals(0.7, policy.thresholdFor(MethodRole.ANALYZER));
        assertEquals(0.65, policy.thresholdFor(MethodRole.AGGREGATE));
        assertEquals(0.6, policy.thresholdFor(MethodRole.UTILITY));
        assertEquals(0.55, policy.thresholdFor(MethodRole.ANALYZER, 0.55));
    }
}
