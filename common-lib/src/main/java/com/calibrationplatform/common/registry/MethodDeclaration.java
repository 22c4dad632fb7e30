package com.calibrationplatform.common.registry;

import com.calibrationplatform.common.model.CanonicalLayer;
import com.calibrationplatform.common.model.MethodRole;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Everything the configuration states about one method.
 *
 * @param activeLayers     layers the method declares it is calibrated on
 * @param waivers          approved exemptions for required layers left out of {@code activeLayers}
 * @param outputRange      identifier of the method's output scale, e.g. {@code "unit_interval"}
 * @param transformableTo  output ranges this method's output can be converted to
 * @param fusionRequirements inputs a fusion step needs from this method's group
 * @param threshold        pass-threshold override, {@code null} to use the role threshold
 */
public record MethodDeclaration(
    @JsonProperty("method_id")           String methodId,
    @JsonProperty("role")                MethodRole role,
    @JsonProperty("version")             String version,
    @JsonProperty("active_layers")       Set<CanonicalLayer> activeLayers,
    @JsonProperty("waivers")             Map<CanonicalLayer, LayerWaiver> waivers,
    @JsonProperty("compatibility")       CompatibilityDeclaration compatibility,
    @JsonProperty("output_range")        String outputRange,
    @JsonProperty("transformable_to")    Set<String> transformableTo,
    @JsonProperty("concept_tags")        Set<String> conceptTags,
    @JsonProperty("fusion_requirements") Set<String> fusionRequirements,
    @JsonProperty("threshold")           Double threshold
) {
    public MethodDeclaration {
        Objects.requireNonNull(methodId, "methodId");
        Objects.requireNonNull(role, "role");
        activeLayers = activeLayers == null || activeLayers.isEmpty()
            ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(activeLayers));
        EnumMap<CanonicalLayer, LayerWaiver> w = new EnumMap<>(CanonicalLayer.class);
        if (waivers != null) w.putAll(waivers);
        waivers = Collections.unmodifiableMap(w);
        compatibility      = compatibility == null ? CompatibilityDeclaration.none() : compatibility;
        transformableTo    = sorted(transformableTo);
        conceptTags        = sorted(conceptTags);
        fusionRequirements = sorted(fusionRequirements);
    }

    private static Set<String> sorted(Set<String> values) {
        return values == null ? Set.of() : Collections.unmodifiableSortedSet(new TreeSet<>(values));
    }

    /** Active layers in canonical order. */
    public EnumSet<CanonicalLayer> orderedActiveLayers() {
        return activeLayers.isEmpty() ? EnumSet.noneOf(CanonicalLayer.class) : EnumSet.copyOf(activeLayers);
    }
}
