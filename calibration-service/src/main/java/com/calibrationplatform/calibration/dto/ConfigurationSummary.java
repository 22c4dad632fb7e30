package com.calibrationplatform.calibration.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public record ConfigurationSummary(
    @JsonProperty("version")         String version,
    @JsonProperty("config_hash")     String configHash,
    @JsonProperty("declared_methods") int declaredMethods,
    @JsonProperty("required_layers") Map<String, List<String>> requiredLayers
) {}
