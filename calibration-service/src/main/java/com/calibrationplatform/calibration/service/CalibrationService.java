package com.calibrationplatform.calibration.service;

import com.calibrationplatform.calibration.dto.CalibrationRequest;
import com.calibrationplatform.calibration.dto.SubjectCalibrationResponse;
import com.calibrationplatform.calibration.engine.CalibrationEngine;
import com.calibrationplatform.calibration.engine.CalibrationRun;
import com.calibrationplatform.common.decision.Decision;
import com.calibrationplatform.common.decision.ValidationDecisionLayer;
import com.calibrationplatform.common.evidence.EvidenceBundle;
import com.calibrationplatform.common.model.CalibrationSubject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Calibrates a single subject and decides whether it may run.
 *
 * <p>Always fail-closed: absent evidence never produces a PASS.
 */
@Service
public class CalibrationService {

    private static final Logger log = LoggerFactory.getLogger(CalibrationService.class);

    private final CalibrationEngine engine;
    private final ValidationDecisionLayer decisionLayer;

    public CalibrationService(CalibrationEngine engine, ValidationDecisionLayer decisionLayer) {
        this.engine = engine;
        this.decisionLayer = decisionLayer;
    }

    public Mono<SubjectCalibrationResponse> calibrate(CalibrationRequest request) {
        return Mono.fromCallable(() -> evaluate(request.toSubject(), request.toEvidence()))
            .subscribeOn(Schedulers.boundedElastic());
    }

    /** Synchronous core, shared with plan validation. */
    public SubjectCalibrationResponse evaluate(CalibrationSubject subject, EvidenceBundle evidence) {
        CalibrationRun run = engine.calibrateFailClosed(subject, evidence);
        if (run.isSkipped()) {
            return new SubjectCalibrationResponse(
                Decision.skipped(run.methodId(), run.nodeId(), run.skipStatus()), null);
        }
        Decision decision = decisionLayer.decide(run.certificate(), run.threshold());
        if (decision.failureReason() != null) {
            log.info("[CalibrationService] method={} node={} outcome={} reason={} layer={}",
                subject.methodId(), subject.nodeId(), decision.outcome(),
                decision.failureReason(), decision.failedLayer());
        }
        return new SubjectCalibrationResponse(decision, run.certificate());
    }

    /** Threshold the subject would be judged against; used when reporting errors. */
    public double thresholdFor(CalibrationSubject subject) {
        Double override = engine.configuration().methods().find(subject.methodId())
            .map(d -> d.threshold()).orElse(null);
        return engine.configuration().decisionPolicy().thresholdFor(subject.role(), override);
    }
}
