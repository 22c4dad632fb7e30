package com.calibrationplatform.common.registry;

import com.calibrationplatform.common.model.CanonicalLayer;
import com.calibrationplatform.common.model.CompatibilityTier;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * A method's declared suitability per question, dimension and policy area.
 * Keys absent from a table resolve to {@link CompatibilityTier#UNDECLARED}.
 */
public record CompatibilityDeclaration(
    @JsonProperty("questions")    Map<String, CompatibilityTier> questions,
    @JsonProperty("dimensions")   Map<String, CompatibilityTier> dimensions,
    @JsonProperty("policy_areas") Map<String, CompatibilityTier> policyAreas
) {
    public CompatibilityDeclaration {
        questions   = questions == null ? Map.of() : Map.copyOf(questions);
        dimensions  = dimensions == null ? Map.of() : Map.copyOf(dimensions);
        policyAreas = policyAreas == null ? Map.of() : Map.copyOf(policyAreas);
    }

    public static CompatibilityDeclaration none() {
        return new CompatibilityDeclaration(Map.of(), Map.of(), Map.of());
    }

    public Map<String, CompatibilityTier> tableFor(CanonicalLayer layer) {
        return switch (layer) {
            case QUESTION -> questions;
            case DIMENSION -> dimensions;
            case POLICY -> policyAreas;
            case BASE, CHAIN, UNIT, CONGRUENCE, META ->
                throw new IllegalArgumentException("Not a contextual layer: " + layer.symbol());
        };
    }

    public CompatibilityTier tierFor(CanonicalLayer layer, String key) {
        return tableFor(layer).getOrDefault(key, CompatibilityTier.UNDECLARED);
    }
}
