package com.calibrationplatform.common.certificate;

import com.calibrationplatform.common.fusion.FusionTerm;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Immutable audit record of one calibration.
 *
 * <p>Everything needed to reproduce {@code calibration_score} is inside the certificate:
 * the structured fusion terms re-add to the score bit-for-bit (see {@link CertificateVerifier}).
 * {@code certificate_digest} covers every field except the timestamp and the digest itself.
 */
public record CalibrationCertificate(
    @JsonProperty("instance_id")           String instanceId,
    @JsonProperty("method")                String method,
    @JsonProperty("node")                  String node,
    @JsonProperty("role")                  String role,
    @JsonProperty("context")               CertificateContext context,
    @JsonProperty("calibration_score")     double calibrationScore,
    @JsonProperty("linear_score")          double linearScore,
    @JsonProperty("interaction_score")     double interactionScore,
    @JsonProperty("layer_breakdown")       Map<String, LayerBreakdown> layerBreakdown,
    @JsonProperty("interaction_breakdown") Map<String, InteractionBreakdown> interactionBreakdown,
    @JsonProperty("fusion_formula")        FusionFormula fusionFormula,
    @JsonProperty("parameter_provenance")  Map<String, ParameterProvenance> parameterProvenance,
    @JsonProperty("validation_checks")     ValidationChecks validationChecks,
    @JsonProperty("sensitivity_analysis")  SensitivityAnalysis sensitivityAnalysis,
    @JsonProperty("audit_trail")           AuditTrail auditTrail,
    @JsonProperty("certificate_digest")    String certificateDigest
) {

    public record CertificateContext(
        @JsonProperty("question")     String question,
        @JsonProperty("dimension")    String dimension,
        @JsonProperty("policy")       String policy,
        @JsonProperty("unit_quality") double unitQuality
    ) {}

    public record LayerBreakdown(
        @JsonProperty("score")      double score,
        @JsonProperty("components") Map<String, Double> components,
        @JsonProperty("evidence")   Map<String, Object> evidence,
        @JsonProperty("formula")    String formula,
        @JsonProperty("rationale")  String rationale
    ) {}

    public record InteractionBreakdown(
        @JsonProperty("contribution")   double contribution,
        @JsonProperty("weight")         double weight,
        @JsonProperty("formula")        String formula,
        @JsonProperty("interpretation") String interpretation
    ) {}

    public record FusionFormula(
        @JsonProperty("symbolic")          String symbolic,
        @JsonProperty("expanded")          String expanded,
        @JsonProperty("computation_trace") List<String> computationTrace,
        @JsonProperty("terms")             List<FusionTerm> terms
    ) {}

    public record ParameterProvenance(
        @JsonProperty("value")   double value,
        @JsonProperty("source")  String source,
        @JsonProperty("version") String version
    ) {}

    public record Check(
        @JsonProperty("passed") boolean passed,
        @JsonProperty("detail") String detail
    ) {}

    public record ValidationChecks(
        @JsonProperty("boundedness")   Check boundedness,
        @JsonProperty("normalization") Check normalization,
        @JsonProperty("completeness")  Check completeness
    ) {
        public boolean allPassed() {
            return boundedness.passed() && normalization.passed() && completeness.passed();
        }
    }

    /**
     * Headroom = how much the final score would rise if the layer (or the weaker side
     * of the interaction) were perfect. The most impactful entry is the first with the
     * largest positive headroom, in canonical layer order or configuration order;
     * {@code null} when nothing has headroom.
     */
    public record SensitivityAnalysis(
        @JsonProperty("most_impactful_layer")       String mostImpactfulLayer,
        @JsonProperty("most_impactful_interaction") String mostImpactfulInteraction,
        @JsonProperty("layer_headroom")             Map<String, Double> layerHeadroom,
        @JsonProperty("interaction_headroom")       Map<String, Double> interactionHeadroom
    ) {}

    public record AuditTrail(
        @JsonProperty("timestamp")         String timestamp,
        @JsonProperty("config_hash")       String configHash,
        @JsonProperty("graph_hash")        String graphHash,
        @JsonProperty("validator_version") String validatorVersion
    ) {}

    /** Copy with the fields the digest does not cover blanked out. */
    CalibrationCertificate digestView() {
        AuditTrail audit = new AuditTrail(null, auditTrail.configHash(), auditTrail.graphHash(),
            auditTrail.validatorVersion());
        return new CalibrationCertificate(instanceId, method, node, role, context, calibrationScore,
            linearScore, interactionScore, layerBreakdown, interactionBreakdown, fusionFormula,
            parameterProvenance, validationChecks, sensitivityAnalysis, audit, null);
    }

    CalibrationCertificate withDigest(String digest) {
        return new CalibrationCertificate(instanceId, method, node, role, context, calibrationScore,
            linearScore, interactionScore, layerBreakdown, interactionBreakdown, fusionFormula,
            parameterProvenance, validationChecks, sensitivityAnalysis, auditTrail, digest);
    }
}
