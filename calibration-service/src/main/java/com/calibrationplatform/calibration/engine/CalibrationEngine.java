package com.calibrationplatform.calibration.engine;

import com.calibrationplatform.common.certificate.CalibrationCertificate;
import com.calibrationplatform.common.certificate.CertificateBuilder;
import com.calibrationplatform.common.config.CalibrationConfiguration;
import com.calibrationplatform.common.evidence.EvidenceBundle;
import com.calibrationplatform.common.exception.EvidenceException;
import com.calibrationplatform.common.fusion.FusionConfiguration;
import com.calibrationplatform.common.fusion.FusionOperator;
import com.calibrationplatform.common.fusion.FusionResult;
import com.calibrationplatform.common.layer.LayerInput;
import com.calibrationplatform.common.layer.LayerScoreCatalog;
import com.calibrationplatform.common.model.CalibrationSubject;
import com.calibrationplatform.common.model.CanonicalLayer;
import com.calibrationplatform.common.model.IntrinsicStatus;
import com.calibrationplatform.common.model.LayerScore;
import com.calibrationplatform.common.registry.IntrinsicScoreRegistry;
import com.calibrationplatform.common.registry.MethodDeclaration;
import com.calibrationplatform.common.requirement.LayerRequirementResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Sequences one calibration: resolve layers → score each → fuse → certify.
 *
 * <h3>Stage order</h3>
 * <ol>
 *   <li>Method id resolution: aliases map to the canonical declared id.</li>
 *   <li>Registry check: an {@code excluded} method is skipped, never scored.</li>
 *   <li>Layer resolution: declared active layers, or the role's required set when undeclared.</li>
 *   <li>Layer scoring in canonical order.</li>
 *   <li>Choquet fusion with the role's weights.</li>
 *   <li>Certificate assembly.</li>
 * </ol>
 *
 * <p>{@link #calibrate} propagates {@link EvidenceException}. {@link #calibrateFailClosed}
 * instead records the layer at 0.0 with the missing field named, and the certificate's
 * completeness check fails.
 */
public class CalibrationEngine {

    private static final Logger log = LoggerFactory.getLogger(CalibrationEngine.class);

    private final CalibrationConfiguration configuration;
    private final IntrinsicScoreRegistry intrinsicRegistry;
    private final LayerScoreCatalog catalog;
    private final LayerRequirementResolver resolver;
    private final FusionOperator fusionOperator;
    private final CertificateBuilder certificateBuilder;

    public CalibrationEngine(CalibrationConfiguration configuration,
                             IntrinsicScoreRegistry intrinsicRegistry,
                             FusionOperator fusionOperator,
                             CertificateBuilder certificateBuilder) {
        this.configuration = configuration;
        this.intrinsicRegistry = intrinsicRegistry;
        this.fusionOperator = fusionOperator;
        this.certificateBuilder = certificateBuilder;
        this.catalog = new LayerScoreCatalog(configuration.rubric(), intrinsicRegistry, configuration.methods());
        this.resolver = configuration.resolver();
    }

    public CalibrationRun calibrate(CalibrationSubject subject, EvidenceBundle evidence) {
        return run(subject, evidence, false);
    }

    public CalibrationRun calibrateFailClosed(CalibrationSubject subject, EvidenceBundle evidence) {
        return run(subject, evidence, true);
    }

    private CalibrationRun run(CalibrationSubject requested, EvidenceBundle evidence, boolean failClosed) {
        CalibrationSubject subject = canonical(requested);
        IntrinsicStatus status = intrinsicRegistry.getIntrinsic(subject.methodId()).status();
        if (status == IntrinsicStatus.EXCLUDED) {
            log.info("[CalibrationEngine] method={} excluded by intrinsic registry, skipping", subject.methodId());
            return CalibrationRun.skipped(subject.methodId(), subject.nodeId(), status.key());
        }

        MethodDeclaration declaration = configuration.methods().find(subject.methodId()).orElse(null);
        if (declaration == null) {
            log.warn("[CalibrationEngine] method={} not declared; using required layers of role={}",
                subject.methodId(), subject.role().key());
        } else if (declaration.role() != subject.role()) {
            log.warn("[CalibrationEngine] method={} declared as role={} but calibrated as role={}",
                subject.methodId(), declaration.role().key(), subject.role().key());
        }

        Set<CanonicalLayer> required = resolver.enforcedLayers(subject.role(), declaration);
        Set<CanonicalLayer> active = resolver.activeLayers(subject.role(), declaration);
        LayerInput input = new LayerInput(subject, evidence, declaration);

        Map<CanonicalLayer, LayerScore> scores = new EnumMap<>(CanonicalLayer.class);
        for (CanonicalLayer layer : active) {
            try {
                scores.put(layer, catalog.evaluate(layer, input));
            } catch (EvidenceException e) {
                if (!failClosed) throw e;
                log.warn("[CalibrationEngine] method={} node={} layer={} fail-closed: missing {}",
                    subject.methodId(), subject.nodeId(), layer.symbol(), e.getField());
                scores.put(layer, LayerScore.failClosed(layer, e.getField()));
            }
        }

        FusionConfiguration fusion = configuration.fusionFor(subject.role());
        FusionResult result = fusionOperator.fuse(scores, fusion);
        CalibrationCertificate certificate = certificateBuilder.build(subject, evidence, scores, required,
            fusion, result, configuration.configHash());

        double threshold = configuration.decisionPolicy()
            .thresholdFor(subject.role(), declaration == null ? null : declaration.threshold());
        log.debug("[CalibrationEngine] method={} node={} layers={} score={} threshold={}",
            subject.methodId(), subject.nodeId(), scores.keySet(), result.finalScore(), threshold);
        return CalibrationRun.completed(certificate, threshold);
    }

    private CalibrationSubject canonical(CalibrationSubject subject) {
        String methodId = configuration.methods().resolve(subject.methodId());
        if (methodId.equals(subject.methodId())) return subject;
        log.debug("[CalibrationEngine] method={} resolved to {}", subject.methodId(), methodId);
        return new CalibrationSubject(methodId, subject.nodeId(), subject.role(), subject.context(),
            subject.interplay());
    }

    public CalibrationConfiguration configuration() {
        return configuration;
    }
}
