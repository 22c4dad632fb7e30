package com.calibrationplatform.calibration.controller;

import com.calibrationplatform.calibration.dto.CalibrationRequest;
import com.calibrationplatform.calibration.dto.ConfigurationSummary;
import com.calibrationplatform.calibration.dto.PlanValidationRequest;
import com.calibrationplatform.calibration.dto.SubjectCalibrationResponse;
import com.calibrationplatform.calibration.logger.CalibrationFlowLogger;
import com.calibrationplatform.calibration.service.CalibrationService;
import com.calibrationplatform.calibration.service.PlanValidationService;
import com.calibrationplatform.common.config.CalibrationConfiguration;
import com.calibrationplatform.common.decision.PlanValidationReport;
import com.calibrationplatform.common.model.CanonicalLayer;
import com.calibrationplatform.common.trace.TraceContextUtil;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/calibration")
public class CalibrationController {

    private final CalibrationService calibrationService;
    private final PlanValidationService planValidationService;
    private final CalibrationConfiguration configuration;
    private final CalibrationFlowLogger flowLogger;

    public CalibrationController(CalibrationService calibrationService,
                                 PlanValidationService planValidationService,
                                 CalibrationConfiguration configuration,
                                 CalibrationFlowLogger flowLogger) {
        this.calibrationService = calibrationService;
        this.planValidationService = planValidationService;
        this.configuration = configuration;
        this.flowLogger = flowLogger;
    }

    @PostMapping("/subject")
    public Mono<ResponseEntity<SubjectCalibrationResponse>> calibrate(@RequestBody CalibrationRequest request) {
        Mono<SubjectCalibrationResponse> pipeline = Mono.just(request)
            .doOnEach(flowLogger.stage(CalibrationFlowLogger.CALIBRATION_REQUESTED))
            .flatMap(calibrationService::calibrate)
            .doOnEach(flowLogger.decision());
        return TraceContextUtil.withTraceId(pipeline, TraceContextUtil.resolveTraceId(request.traceId()))
            .map(ResponseEntity::ok);
    }

    @PostMapping("/plan")
    public Mono<ResponseEntity<PlanValidationReport>> validatePlan(@RequestBody PlanValidationRequest request) {
        Mono<PlanValidationReport> pipeline = Mono.just(request)
            .doOnEach(flowLogger.stage(CalibrationFlowLogger.PLAN_STARTED))
            .flatMap(planValidationService::validatePlan)
            .doOnEach(flowLogger.plan());
        return TraceContextUtil.withTraceId(pipeline, TraceContextUtil.resolveTraceId(request.traceId()))
            .map(ResponseEntity::ok);
    }

    @GetMapping("/config")
    public ResponseEntity<ConfigurationSummary> configuration() {
        Map<String, List<String>> required = new LinkedHashMap<>();
        configuration.requirements().asMap().forEach((role, layers) ->
            required.put(role.key(), layers.stream().map(CanonicalLayer::symbol).toList()));
        return ResponseEntity.ok(new ConfigurationSummary(configuration.version(), configuration.configHash(),
            configuration.methods().size(), required));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
