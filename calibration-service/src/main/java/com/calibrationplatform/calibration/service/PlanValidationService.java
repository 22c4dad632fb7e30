package com.calibrationplatform.calibration.service;

import com.calibrationplatform.calibration.dto.CalibrationRequest;
import com.calibrationplatform.calibration.dto.PlanValidationRequest;
import com.calibrationplatform.common.config.DecisionPolicy;
import com.calibrationplatform.common.decision.Decision;
import com.calibrationplatform.common.decision.PlanValidationReport;
import com.calibrationplatform.common.decision.PlanValidator;
import com.calibrationplatform.common.model.CalibrationSubject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Calibrates every subject of a plan in parallel and aggregates the decisions.
 *
 * <p>Subjects are independent: one timing out surfaces as SKIPPED with status
 * {@code TIMEOUT}, one throwing surfaces as FAIL with score 0.0; neither affects the others.
 */
@Service
public class PlanValidationService {

    private static final Logger log = LoggerFactory.getLogger(PlanValidationService.class);

    static final String TIMEOUT_STATUS = "TIMEOUT";

    private final CalibrationService calibrationService;
    private final DecisionPolicy decisionPolicy;
    private final Duration subjectTimeout;
    private final int maxConcurrency;

    public PlanValidationService(CalibrationService calibrationService,
                                 DecisionPolicy decisionPolicy,
                                 @Value("${calibration.plan.subject-timeout:PT10S}") Duration subjectTimeout,
                                 @Value("${calibration.plan.max-concurrency:16}") int maxConcurrency) {
        this.calibrationService = calibrationService;
        this.decisionPolicy = decisionPolicy;
        this.subjectTimeout = subjectTimeout;
        this.maxConcurrency = maxConcurrency;
    }

    public Mono<PlanValidationReport> validatePlan(PlanValidationRequest request) {
        String planId = request.planId() == null ? UUID.randomUUID().toString() : request.planId();
        log.info("[PlanValidation] plan={} dispatching {} subjects, maxConcurrency={} timeout={}",
            planId, request.subjects().size(), maxConcurrency, subjectTimeout);
        return Flux.fromIterable(request.subjects())
            .flatMap(this::decide, maxConcurrency)
            .collectList()
            .map(decisions -> PlanValidator.aggregate(planId, decisions, decisionPolicy.planPassRatio()));
    }

    private Mono<Decision> decide(CalibrationRequest item) {
        CalibrationSubject subject;
        try {
            subject = item.toSubject();
        } catch (IllegalArgumentException e) {
            log.warn("[PlanValidation] rejecting malformed subject method={} node={}: {}",
                item.methodId(), item.nodeId(), e.getMessage());
            return Mono.just(Decision.error(String.valueOf(item.methodId()), String.valueOf(item.nodeId()),
                decisionPolicy.defaultThreshold(), e.getMessage()));
        }
        return Mono.fromCallable(() -> calibrationService.evaluate(subject, item.toEvidence()).decision())
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(subjectTimeout)
            .onErrorResume(TimeoutException.class, e -> {
                log.warn("[PlanValidation] method={} node={} timed out after {}",
                    subject.methodId(), subject.nodeId(), subjectTimeout);
                return Mono.just(Decision.skipped(subject.methodId(), subject.nodeId(), TIMEOUT_STATUS));
            })
            .onErrorResume(e -> !(e instanceof TimeoutException), e -> {
                log.error("[PlanValidation] method={} node={} failed", subject.methodId(), subject.nodeId(), e);
                return Mono.just(Decision.error(subject.methodId(), subject.nodeId(),
                    calibrationService.thresholdFor(subject), e.getMessage()));
            });
    }
}
