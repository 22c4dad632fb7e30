package com.calibrationplatform.calibration.config;

import com.calibrationplatform.common.config.ContextDomain;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * On-disk shape of {@code calibration-config.json}. Layers are written as symbols
 * ({@code "@b"}) and roles in lower case; conversion to the typed model happens in
 * {@link CalibrationConfigurationLoader}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CalibrationConfigDocument(
    @JsonProperty("version")                     String version,
    @JsonProperty("anti_universality_threshold") Double antiUniversalityThreshold,
    @JsonProperty("fusion")                      Map<String, FusionDocument> fusion,
    @JsonProperty("requirements")                Map<String, List<String>> requirements,
    @JsonProperty("rubric")                      JsonNode rubric,
    @JsonProperty("decision")                    DecisionDocument decision,
    @JsonProperty("domain")                      ContextDomain domain,
    @JsonProperty("methods")                     List<MethodDocument> methods
) {

    public record FusionDocument(
        @JsonProperty("linear")       Map<String, Double> linear,
        @JsonProperty("interactions") List<InteractionDocument> interactions,
        @JsonProperty("source")       String source,
        @JsonProperty("version")      String version
    ) {}

    public record InteractionDocument(
        @JsonProperty("layers")    List<String> layers,
        @JsonProperty("weight")    Double weight,
        @JsonProperty("rationale") String rationale
    ) {}

    public record DecisionDocument(
        @JsonProperty("default_threshold")     Double defaultThreshold,
        @JsonProperty("role_thresholds")       Map<String, Double> roleThresholds,
        @JsonProperty("conditional_tolerance") Double conditionalTolerance,
        @JsonProperty("attribution_floor")     Double attributionFloor,
        @JsonProperty("plan_pass_ratio")       Double planPassRatio
    ) {}

    public record UnitDocument(
        @JsonProperty("functions")                 Map<String, JsonNode> functions,
        @JsonProperty("min_structural_compliance") Double minStructuralCompliance,
        @JsonProperty("require_indicator_matrix")  Boolean requireIndicatorMatrix,
        @JsonProperty("require_ppi_presence")      Boolean requirePpiPresence
    ) {}

    public record WaiverDocument(
        @JsonProperty("justification") String justification,
        @JsonProperty("approved_by")   String approvedBy
    ) {}

    public record CompatibilityDocument(
        @JsonProperty("questions")    Map<String, String> questions,
        @JsonProperty("dimensions")   Map<String, String> dimensions,
        @JsonProperty("policy_areas") Map<String, String> policyAreas
    ) {}

    public record MethodDocument(
        @JsonProperty("method_id")           String methodId,
        @JsonProperty("role")                String role,
        @JsonProperty("version")             String version,
        @JsonProperty("active_layers")       List<String> activeLayers,
        @JsonProperty("waivers")             Map<String, WaiverDocument> waivers,
        @JsonProperty("compatibility")       CompatibilityDocument compatibility,
        @JsonProperty("output_range")        String outputRange,
        @JsonProperty("transformable_to")    List<String> transformableTo,
        @JsonProperty("concept_tags")        List<String> conceptTags,
        @JsonProperty("fusion_requirements") List<String> fusionRequirements,
        @JsonProperty("threshold")           Double threshold
    ) {}
}
