package com.calibrationplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one layer evaluator for one subject.
 *
 * <p>{@code components} and {@code evidence} keep insertion order so serialized
 * certificates are reproducible.
 */
public record LayerScore(
    @JsonProperty("layer")      CanonicalLayer layer,
    @JsonProperty("score")      double value,
    @JsonProperty("components") Map<String, Double> components,
    @JsonProperty("evidence")   Map<String, Object> evidence,
    @JsonProperty("formula")    String formula,
    @JsonProperty("rationale")  String rationale
) {
    public LayerScore {
        Objects.requireNonNull(layer, "layer");
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(
                "Layer " + layer.symbol() + " score out of [0,1]: " + value);
        }
        components = Collections.unmodifiableMap(new LinkedHashMap<>(
            components == null ? Map.of() : components));
        evidence = Collections.unmodifiableMap(new LinkedHashMap<>(
            evidence == null ? Map.of() : evidence));
    }

    public static LayerScore of(CanonicalLayer layer, double value, String formula, String rationale) {
        return new LayerScore(layer, value, Map.of(), Map.of(), formula, rationale);
    }

    /** Worst-case score used when the layer's evidence is absent. */
    public static LayerScore failClosed(CanonicalLayer layer, String missingField) {
        return new LayerScore(layer, 0.0, Map.of(), Map.of("missing_field", missingField),
            "0.0", "fail-closed: missing field " + missingField);
    }

    @JsonIgnore
    public boolean isFailClosed() {
        return rationale != null && rationale.startsWith("fail-closed");
    }
}
