package com.calibrationplatform.common.certificate;

import com.calibrationplatform.common.CalibrationFixtures;
import com.calibrationplatform.common.certificate.CertificateVerifier.Verification;
import com.calibrationplatform.common.digest.ContentHasher;
import com.calibrationplatform.common.fusion.ChoquetFusionOperator;
import com.calibrationplatform.common.fusion.FusionConfiguration;
import com.calibrationplatform.common.model.CalibrationSubject;
import com.calibrationplatform.common.model.CanonicalLayer;
import com.calibrationplatform.common.model.InteractionTerm;
import com.calibrationplatform.common.model.LayerScore;
import com.calibrationplatform.common.model.MethodRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.calibrationplatform.common.model.CanonicalLayer.*;
import static org.junit.jupiter.api.Assertions.*;

class CertificateBuilderTest {

    private final FusionConfiguration fusion = CalibrationFixtures.scenarioCFusion();
    private final Map<CanonicalLayer, LayerScore> scores = CalibrationFixtures.scenarioCScores();

    private CalibrationCertificate build(Clock clock, CalibrationSubject subject,
                                         Map<CanonicalLayer, LayerScore> layerScores) {
        return CalibrationFixtures.certificateBuilder(clock).build(subject, CalibrationFixtures.fullEvidence(),
            layerScores, EnumSet.allOf(CanonicalLayer.class), fusion,
            new ChoquetFusionOperator().fuse(layerScores, fusion), CalibrationFixtures.CONFIG_HASH);
    }

    private CalibrationCertificate build() {
        return build(CalibrationFixtures.FIXED_CLOCK, CalibrationFixtures.analyzer(0.8), scores);
    }

    // ── reproducibility ───────────────────────────────────────────────────

    @Nested
    @DisplayName("reproducibility")
    class Reproducibility {

        @Test
        @DisplayName("same inputs and fixed clock → byte-identical canonical JSON")
        void identicalRuns() {
            assertEquals(ContentHasher.canonicalJson(build()), ContentHasher.canonicalJson(build()));
        }

        @Test
        @DisplayName("digest and instance id ignore the timestamp")
        void digestExcludesTimestamp() {
            Clock later = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
            CalibrationCertificate a = build();
            CalibrationCertificate b = build(later, CalibrationFixtures.analyzer(0.8), scores);
            assertNotEquals(a.auditTrail().timestamp(), b.auditTrail().timestamp());
            assertEquals(a.certificateDigest(), b.certificateDigest());
            assertEquals(a.instanceId(), b.instanceId());
        }

        @Test
        @DisplayName("a different node yields a different instance id")
        void instanceIdPerNode() {
            CalibrationSubject other = CalibrationSubject.of(CalibrationFixtures.ANALYZER_ID, "node-2",
                CalibrationFixtures.analyzer(0.8).role(), CalibrationFixtures.context(0.8));
            assertNotEquals(build().instanceId(), build(CalibrationFixtures.FIXED_CLOCK, other, scores).instanceId());
        }

        @Test
        @DisplayName("parallel builds agree with the sequential one")
        void concurrentBuilds() throws Exception {
            String expected = ContentHasher.canonicalJson(build());
            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                List<Future<String>> futures = new ArrayList<>();
                for (int i = 0; i < 64; i++) {
                    futures.add(pool.submit(() -> ContentHasher.canonicalJson(build())));
                }
                for (Future<String> f : futures) assertEquals(expected, f.get());
            } finally {
                pool.shutdownNow();
            }
        }
    }

    // ── content ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("content")
    class Content {

        @Test
        @DisplayName("score, partial sums and breakdown keys in canonical order")
        void scoreAndBreakdown() {
            CalibrationCertificate c = build();
            assertEquals(0.862, c.calibrationScore(), 0.001);
            assertEquals(c.calibrationScore(), c.linearScore() + c.interactionScore(), 1e-12);
            assertEquals(List.of("@b", "@chain", "@u", "@q", "@d", "@p", "@C", "@m"),
                new ArrayList<>(c.layerBreakdown().keySet()));
            assertEquals(List.of("(@u,@chain)", "(@chain,@C)", "(@q,@d)"),
                new ArrayList<>(c.interactionBreakdown().keySet()));
        }

        @Test
        @DisplayName("interaction interpretation carries the configured rationale")
        void interactionRationale() {
            assertTrue(build().interactionBreakdown().get("(@u,@chain)").interpretation()
                .startsWith("Plan quality only matters with sound wiring"));
        }

        @Test
        @DisplayName("every weight has provenance")
        void provenance() {
            CalibrationCertificate c = build();
            assertTrue(c.parameterProvenance().containsKey("a_@b"));
            assertTrue(c.parameterProvenance().containsKey("a_(@u,@chain)"));
            assertEquals("scenario-c", c.parameterProvenance().get("a_@m").source());
            assertFalse(c.parameterProvenance().containsKey("base_fallback"));
        }

        @Test
        @DisplayName("a fallback @b score is recorded in provenance")
        void baseFallbackProvenance() {
            Map<CanonicalLayer, LayerScore> pending = new EnumMap<>(scores);
            pending.put(BASE, new LayerScore(BASE, 0.5, Map.of(), Map.of("registry_status", "pending"), "", ""));
            CalibrationCertificate c = build(CalibrationFixtures.FIXED_CLOCK, CalibrationFixtures.analyzer(0.8), pending);
            assertEquals("rubric.base.pending_score", c.parameterProvenance().get("base_fallback").source());
        }

        @Test
        @DisplayName("sensitivity names the layer and interaction with the most headroom")
        void sensitivity() {
            CalibrationCertificate c = build();
            assertEquals("@u", c.sensitivityAnalysis().mostImpactfulLayer());
            assertEquals("(@u,@chain)", c.sensitivityAnalysis().mostImpactfulInteraction());
            assertEquals(0.0, c.sensitivityAnalysis().layerHeadroom().get("@chain"), 1e-12);
        }

        @Test
        @DisplayName("all layers perfect → no impactful layer or interaction")
        void noHeadroom() {
            Map<CanonicalLayer, LayerScore> perfect = CalibrationFixtures.uniform(EnumSet.allOf(CanonicalLayer.class), 1.0);
            CalibrationCertificate c = build(CalibrationFixtures.FIXED_CLOCK, CalibrationFixtures.analyzer(0.8), perfect);
            assertNull(c.sensitivityAnalysis().mostImpactfulLayer());
            assertNull(c.sensitivityAnalysis().mostImpactfulInteraction());
        }

        @Test
        @DisplayName("equal headroom goes to the earlier canonical layer and the earlier configured interaction")
        void sensitivityTies() {
            FusionConfiguration symmetric = new FusionConfiguration(MethodRole.UTILITY,
                Map.of(BASE, 0.3, CHAIN, 0.3, UNIT, 0.2),
                List.of(new InteractionTerm(BASE, UNIT, 0.1, null), new InteractionTerm(CHAIN, UNIT, 0.1, null)),
                "test", "1");
            CalibrationCertificate c = CalibrationFixtures.certificate(
                CalibrationFixtures.uniform(EnumSet.of(BASE, CHAIN, UNIT), 0.5), symmetric);

            Map<String, Double> layers = c.sensitivityAnalysis().layerHeadroom();
            assertEquals(0, Double.compare(layers.get("@b"), layers.get("@chain")));
            assertEquals("@b", c.sensitivityAnalysis().mostImpactfulLayer());
            assertEquals("(@b,@u)", c.sensitivityAnalysis().mostImpactfulInteraction());
        }

        @Test
        @DisplayName("audit trail carries config hash and validator version")
        void auditTrail() {
            CalibrationCertificate c = build();
            assertEquals(CalibrationFixtures.CONFIG_HASH, c.auditTrail().configHash());
            assertEquals("test-validator", c.auditTrail().validatorVersion());
            assertEquals("2025-11-03T09:30:00Z", c.auditTrail().timestamp());
            assertEquals(64, c.auditTrail().graphHash().length());
        }
    }

    // ── checks ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("validation checks")
    class Checks {

        @Test
        @DisplayName("complete evaluation passes all three checks")
        void allPass() {
            assertTrue(build().validationChecks().allPassed());
        }

        @Test
        @DisplayName("required layer not evaluated fails completeness")
        void missingRequiredLayer() {
            Map<CanonicalLayer, LayerScore> partial = new EnumMap<>(scores);
            partial.remove(POLICY);
            CalibrationCertificate c = build(CalibrationFixtures.FIXED_CLOCK, CalibrationFixtures.analyzer(0.8), partial);
            assertFalse(c.validationChecks().completeness().passed());
            assertTrue(c.validationChecks().completeness().detail().contains("@p"));
        }

        @Test
        @DisplayName("fail-closed layer fails completeness and names the field")
        void failClosedLayer() {
            Map<CanonicalLayer, LayerScore> partial = new EnumMap<>(scores);
            partial.put(META, LayerScore.failClosed(META, "runtime_ms"));
            CalibrationCertificate c = build(CalibrationFixtures.FIXED_CLOCK, CalibrationFixtures.analyzer(0.8), partial);
            assertFalse(c.validationChecks().completeness().passed());
            assertTrue(c.validationChecks().completeness().detail().contains("runtime_ms"));
        }
    }

    // ── verification ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("CertificateVerifier")
    class Verify {

        @Test
        @DisplayName("an issued certificate verifies and recomputes exactly")
        void valid() {
            CalibrationCertificate c = build();
            Verification v = CertificateVerifier.verify(c);
            assertTrue(v.valid(), v.problems().toString());
            assertEquals(0, Double.compare(c.calibrationScore(), v.recomputedScore()));
        }

        @Test
        @DisplayName("an edited score is detected")
        void tamperedScore() {
            CalibrationCertificate c = build();
            CalibrationCertificate tampered = new CalibrationCertificate(c.instanceId(), c.method(), c.node(),
                c.role(), c.context(), 0.99, c.linearScore(), c.interactionScore(), c.layerBreakdown(),
                c.interactionBreakdown(), c.fusionFormula(), c.parameterProvenance(), c.validationChecks(),
                c.sensitivityAnalysis(), c.auditTrail(), c.certificateDigest());
            Verification v = CertificateVerifier.verify(tampered);
            assertFalse(v.valid());
            assertTrue(v.problems().stream().anyMatch(p -> p.contains("digest")));
        }
    }
}
