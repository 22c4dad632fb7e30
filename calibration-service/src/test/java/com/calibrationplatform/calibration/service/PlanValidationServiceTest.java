package com.calibrationplatform.calibration.service;

import com.calibrationplatform.calibration.ServiceFixtures;
import com.calibrationplatform.calibration.dto.CalibrationRequest;
import com.calibrationplatform.calibration.dto.PlanValidationRequest;
import com.calibrationplatform.calibration.dto.SubjectCalibrationResponse;
import com.calibrationplatform.calibration.engine.CalibrationEngine;
import com.calibrationplatform.common.config.DecisionPolicy;
import com.calibrationplatform.common.decision.Decision;
import com.calibrationplatform.common.decision.DecisionOutcome;
import com.calibrationplatform.common.decision.PlanValidationReport;
import com.calibrationplatform.common.decision.ValidationDecisionLayer;
import com.calibrationplatform.common.evidence.EvidenceBundle;
import com.calibrationplatform.common.model.CalibrationSubject;
import com.calibrationplatform.common.model.MethodRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlanValidationServiceTest {

    private static final DecisionPolicy POLICY = ServiceFixtures.configuration().decisionPolicy();

    private static CalibrationRequest full(String methodId, String nodeId, String role) {
        return ServiceFixtures.request(methodId, nodeId, role, ServiceFixtures.fullEvidenceDocument());
    }

    private static PlanValidationService planService(CalibrationService calibrationService, Duration timeout) {
        return new PlanValidationService(calibrationService, POLICY, timeout, 4);
    }

    // ── stubs ─────────────────────────────────────────────────────────────

    /** Calibrates normally but only after a delay longer than the plan's subject timeout. */
    static class SlowCalibrationService extends CalibrationService {
        private final String slowMethod;

        SlowCalibrationService(CalibrationEngine engine, String slowMethod) {
            super(engine, new ValidationDecisionLayer(engine.configuration().decisionPolicy()));
            this.slowMethod = slowMethod;
        }

        @Override
        public SubjectCalibrationResponse evaluate(CalibrationSubject subject, EvidenceBundle evidence) {
            if (subject.methodId().equals(slowMethod)) {
                try {
                    Thread.sleep(2_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return super.evaluate(subject, evidence);
        }
    }

    static class ThrowingCalibrationService extends CalibrationService {
        ThrowingCalibrationService(CalibrationEngine engine) {
            super(engine, new ValidationDecisionLayer(engine.configuration().decisionPolicy()));
        }

        @Override
        public SubjectCalibrationResponse evaluate(CalibrationSubject subject, EvidenceBundle evidence) {
            throw new IllegalStateException("intrinsic registry unavailable");
        }
    }

    // ── aggregation ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("healthy plan")
    class Healthy {

        private final PlanValidationService service =
            planService(ServiceFixtures.calibrationService(), Duration.ofSeconds(10));

        @Test
        @DisplayName("all subjects pass → PASS")
        void allPass() {
            PlanValidationReport report = service.validatePlan(new PlanValidationRequest("plan-1", null, List.of(
                full(ServiceFixtures.ANALYZER, "n1", "analyzer"),
                full(ServiceFixtures.EXTRACT, "n2", "extract")))).block();
            assertNotNull(report);
            assertEquals("plan-1", report.planId());
            assertEquals(DecisionOutcome.PASS, report.overallDecision());
            assertEquals(2, report.passed());
            assertEquals(1.0, report.passRate());
        }

        @Test
        @DisplayName("report does not depend on subject order")
        void orderIndependent() {
            CalibrationRequest a = full(ServiceFixtures.ANALYZER, "n1", "analyzer");
            CalibrationRequest b = full(ServiceFixtures.INGEST, "n2", "ingest");
            CalibrationRequest c = ServiceFixtures.request(ServiceFixtures.UTILITY, "n3", "utility", null);

            PlanValidationReport forward = service.validatePlan(new PlanValidationRequest("p", null, List.of(a, b, c))).block();
            PlanValidationReport reverse = service.validatePlan(new PlanValidationRequest("p", null, List.of(c, b, a))).block();
            assertNotNull(forward);
            assertNotNull(reverse);
            assertEquals(forward.overallDecision(), reverse.overallDecision());
            assertEquals(forward.perMethod(), reverse.perMethod());
            assertEquals(1, forward.failed());
        }

        @Test
        @DisplayName("excluded subject is skipped and does not count against the plan")
        void skippedSubject() {
            PlanValidationReport report = service.validatePlan(new PlanValidationRequest("p", null, List.of(
                full(ServiceFixtures.ANALYZER, "n1", "analyzer"),
                full(ServiceFixtures.EXCLUDED, "n2", "analyzer")))).block();
            assertNotNull(report);
            assertEquals(DecisionOutcome.PASS, report.overallDecision());
            assertEquals(1, report.skipped());
            assertEquals(2, report.total());
        }

        @Test
        @DisplayName("malformed subject becomes a FAIL without stopping the others")
        void malformedSubject() {
            PlanValidationReport report = service.validatePlan(new PlanValidationRequest("p", null, List.of(
                full(ServiceFixtures.ANALYZER, "n1", "analyzer"),
                full(ServiceFixtures.INGEST, "n2", "wizard")))).block();
            assertNotNull(report);
            Decision rejected = report.perMethod().stream()
                .filter(d -> d.nodeId().equals("n2")).findFirst().orElseThrow();
            assertEquals(DecisionOutcome.FAIL, rejected.outcome());
            assertEquals(POLICY.defaultThreshold(), rejected.threshold());
            assertEquals(1, report.passed());
            assertEquals(DecisionOutcome.FAIL, report.overallDecision());
        }

        @Test
        @DisplayName("empty plan is SKIPPED and gets a generated id")
        void emptyPlan() {
            PlanValidationReport report = service.validatePlan(new PlanValidationRequest(null, null, null)).block();
            assertNotNull(report);
            assertEquals(DecisionOutcome.SKIPPED, report.overallDecision());
            assertNotNull(report.planId());
        }
    }

    // ── isolation ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("per-subject isolation")
    class Isolation {

        @Test
        @DisplayName("slow subject is SKIPPED with TIMEOUT; the rest still decide")
        void timeout() {
            SlowCalibrationService slowService = new SlowCalibrationService(ServiceFixtures.engine(), ServiceFixtures.INGEST);
            // warm up serialization so only the slow subject runs into the timeout
            slowService.evaluate(ServiceFixtures.subject(ServiceFixtures.ANALYZER, MethodRole.ANALYZER),
                ServiceFixtures.fullEvidence());
            PlanValidationService service = planService(slowService, Duration.ofMillis(300));
            PlanValidationReport report = service.validatePlan(new PlanValidationRequest("p", null, List.of(
                full(ServiceFixtures.ANALYZER, "n1", "analyzer"),
                full(ServiceFixtures.INGEST, "n2", "ingest")))).block();
            assertNotNull(report);
            Decision slow = report.perMethod().stream()
                .filter(d -> d.methodId().equals(ServiceFixtures.INGEST)).findFirst().orElseThrow();
            assertEquals(DecisionOutcome.SKIPPED, slow.outcome());
            assertEquals(PlanValidationService.TIMEOUT_STATUS, slow.status());
            assertEquals(1, report.passed());
            assertEquals(DecisionOutcome.PASS, report.overallDecision());
        }

        @Test
        @DisplayName("throwing calibration becomes FAIL with score 0 and the error in details")
        void error() {
            PlanValidationService service = planService(
                new ThrowingCalibrationService(ServiceFixtures.engine()), Duration.ofSeconds(10));
            PlanValidationReport report = service.validatePlan(new PlanValidationRequest("p", null, List.of(
                full(ServiceFixtures.ANALYZER, "n1", "analyzer")))).block();
            assertNotNull(report);
            Decision d = report.perMethod().get(0);
            assertEquals(DecisionOutcome.FAIL, d.outcome());
            assertEquals(0.0, d.score());
            assertEquals(0.7, d.threshold());
            assertTrue(d.details().contains("calibration error"));
            assertTrue(d.details().contains("intrinsic registry unavailable"));
            assertEquals(DecisionOutcome.FAIL, report.overallDecision());
        }
    }
}
