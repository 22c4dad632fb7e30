package com.calibrationplatform.calibration.logger;

import com.calibrationplatform.calibration.dto.SubjectCalibrationResponse;
import com.calibrationplatform.common.decision.Decision;
import com.calibrationplatform.common.decision.PlanValidationReport;
import com.calibrationplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Observability for the calibration lifecycle. Side effects only; never changes a result.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #CALIBRATION_REQUESTED}: subject received by the API</li>
 *   <li>{@link #DECISION_MADE}: certificate issued and decision taken</li>
 *   <li>{@link #PLAN_STARTED}: plan fan-out begins</li>
 *   <li>{@link #PLAN_COMPLETED}: plan report aggregated</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(flowLogger.stage(CalibrationFlowLogger.CALIBRATION_REQUESTED))
 * </pre>
 */
@Component
public class CalibrationFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(CalibrationFlowLogger.class);

    public static final String CALIBRATION_REQUESTED = "CALIBRATION_REQUESTED";
    public static final String DECISION_MADE         = "DECISION_MADE";
    public static final String PLAN_STARTED          = "PLAN_STARTED";
    public static final String PLAN_COMPLETED        = "PLAN_COMPLETED";

    /**
     * {@code doOnEach} consumer that logs {@code stageName} on every {@code onNext},
     * reading the trace id from the Reactor Context.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[CalibrationFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    /** {@code doOnEach} consumer for a single-subject decision. */
    public Consumer<Signal<SubjectCalibrationResponse>> decision() {
        return signal -> {
            if (!signal.isOnNext()) return;
            Decision d = signal.get().decision();
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[CalibrationFlow] stage={} method={} node={} outcome={} score={} reason={} traceId={}",
                    DECISION_MADE, d.methodId(), d.nodeId(), d.outcome(),
                    String.format("%.4f", d.score()), d.failureReason(), traceId)
            );
        };
    }

    /** {@code doOnEach} consumer for a finished plan. */
    public Consumer<Signal<PlanValidationReport>> plan() {
        return signal -> {
            if (!signal.isOnNext()) return;
            PlanValidationReport r = signal.get();
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, r.planId(), () ->
                log.info("[CalibrationFlow] stage={} plan={} overall={} passed={} failed={} conditional={} skipped={} traceId={}",
                    PLAN_COMPLETED, r.planId(), r.overallDecision(), r.passed(), r.failed(),
                    r.conditionalPass(), r.skipped(), traceId)
            );
        };
    }
}
