package com.calibrationplatform.calibration.engine;

import com.calibrationplatform.calibration.ServiceFixtures;
import com.calibrationplatform.common.certificate.CalibrationCertificate;
import com.calibrationplatform.common.certificate.CertificateVerifier;
import com.calibrationplatform.common.evidence.ChainEvidence;
import com.calibrationplatform.common.evidence.EvidenceBundle;
import com.calibrationplatform.common.evidence.UnitEvidence;
import com.calibrationplatform.common.exception.EvidenceException;
import com.calibrationplatform.common.model.CalibrationSubject;
import com.calibrationplatform.common.model.CanonicalLayer;
import com.calibrationplatform.common.model.MethodRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CalibrationEngineTest {

    private final CalibrationEngine engine = ServiceFixtures.engine();

    // ── declared methods ──────────────────────────────────────────────────

    @Nested
    @DisplayName("declared analyzer with complete evidence")
    class Analyzer {

        private final CalibrationRun run = engine.calibrate(
            ServiceFixtures.subject(ServiceFixtures.ANALYZER, MethodRole.ANALYZER), ServiceFixtures.fullEvidence());

        @Test
        @DisplayName("all eight layers are scored and the certificate is complete")
        void complete() {
            assertFalse(run.isSkipped());
            CalibrationCertificate cert = run.certificate();
            assertEquals(List.of("@b", "@chain", "@u", "@q", "@d", "@p", "@C", "@m"),
                List.copyOf(cert.layerBreakdown().keySet()));
            assertTrue(cert.validationChecks().allPassed());
            assertEquals(0.8885, cert.layerBreakdown().get("@b").score(), 1e-9);
        }

        @Test
        @DisplayName("score is high and judged against the analyzer threshold")
        void score() {
            assertTrue(run.certificate().calibrationScore() > 0.95, "score " + run.certificate().calibrationScore());
            assertTrue(run.certificate().calibrationScore() <= 1.0);
            assertEquals(0.7, run.threshold());
        }

        @Test
        @DisplayName("the certificate verifies against its own terms")
        void verifies() {
            assertTrue(CertificateVerifier.verify(run.certificate()).valid());
        }

        @Test
        @DisplayName("identical inputs yield identical digests")
        void reproducible() {
            CalibrationRun again = ServiceFixtures.engine().calibrate(
                ServiceFixtures.subject(ServiceFixtures.ANALYZER, MethodRole.ANALYZER), ServiceFixtures.fullEvidence());
            assertEquals(run.certificate().certificateDigest(), again.certificate().certificateDigest());
            assertEquals(run.certificate().instanceId(), again.certificate().instanceId());
        }
    }

    @Test
    @DisplayName("approved waiver: layer not scored, certificate still complete, override threshold used")
    void waivedLayer() {
        CalibrationRun run = engine.calibrate(
            ServiceFixtures.subject(ServiceFixtures.EXTRACT, MethodRole.EXTRACT), ServiceFixtures.fullEvidence());
        CalibrationCertificate cert = run.certificate();
        assertFalse(cert.layerBreakdown().containsKey("@u"));
        assertTrue(cert.validationChecks().completeness().passed(), cert.validationChecks().completeness().detail());
        assertEquals(0.4, run.threshold());
        // pending intrinsic score: .30 * .5 + .20 * 1 + .10 * 1
        assertEquals(0.45, cert.calibrationScore(), 1e-9);
    }

    @Test
    @DisplayName("aliased method id is calibrated and certified under its canonical id")
    void aliasResolved() {
        CalibrationRun run = engine.calibrate(
            ServiceFixtures.subject("analysis::PolicyContradictionDetector::detect", MethodRole.ANALYZER),
            ServiceFixtures.fullEvidence());
        assertEquals(ServiceFixtures.ANALYZER, run.certificate().method());
        assertEquals(8, run.certificate().layerBreakdown().size());
        assertEquals(0.8885, run.certificate().layerBreakdown().get("@b").score(), 1e-9);
    }

    // ── undeclared and excluded ───────────────────────────────────────────

    @Test
    @DisplayName("undeclared method is scored on its role's required layers")
    void undeclared() {
        CalibrationSubject subject = CalibrationSubject.of("scratch.Adhoc.run", "n-9", MethodRole.UTILITY,
            ServiceFixtures.context(0.9));
        CalibrationRun run = engine.calibrate(subject, ServiceFixtures.fullEvidence());
        assertEquals(Set.of("@b", "@chain", "@m"), run.certificate().layerBreakdown().keySet());
        assertEquals(0.3, run.certificate().layerBreakdown().get("@b").score(), 1e-9);
        assertEquals(0.6, run.threshold());
    }

    @Test
    @DisplayName("declared threshold override wins over the default")
    void thresholdOverride() {
        CalibrationRun run = engine.calibrate(
            ServiceFixtures.subject(ServiceFixtures.UTILITY, MethodRole.UTILITY), ServiceFixtures.fullEvidence());
        assertEquals(0.55, run.threshold());
    }

    @Test
    @DisplayName("excluded method is skipped without a certificate")
    void excluded() {
        CalibrationRun run = engine.calibrate(
            ServiceFixtures.subject(ServiceFixtures.EXCLUDED, MethodRole.ANALYZER), ServiceFixtures.fullEvidence());
        assertTrue(run.isSkipped());
        assertEquals("excluded", run.skipStatus());
        assertNull(run.certificate());
    }

    // ── missing evidence ──────────────────────────────────────────────────

    @Nested
    @DisplayName("missing evidence")
    class MissingEvidence {

        private final EvidenceBundle noMeta = EvidenceBundle.of(
            ChainEvidence.clean(Set.of("document")), UnitEvidence.complete(), null);

        @Test
        @DisplayName("strict mode propagates the evidence error")
        void strict() {
            EvidenceException e = assertThrows(EvidenceException.class, () -> engine.calibrate(
                ServiceFixtures.subject(ServiceFixtures.ANALYZER, MethodRole.ANALYZER), noMeta));
            assertEquals(CanonicalLayer.META, e.getLayer());
        }

        @Test
        @DisplayName("fail-closed mode scores the layer 0 and fails completeness")
        void failClosed() {
            CalibrationRun run = engine.calibrateFailClosed(
                ServiceFixtures.subject(ServiceFixtures.ANALYZER, MethodRole.ANALYZER), noMeta);
            CalibrationCertificate.LayerBreakdown meta = run.certificate().layerBreakdown().get("@m");
            assertEquals(0.0, meta.score());
            assertEquals("meta", meta.evidence().get("missing_field"));
            assertFalse(run.certificate().validationChecks().completeness().passed());
        }
    }
}
