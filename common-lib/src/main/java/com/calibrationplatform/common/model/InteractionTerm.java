package com.calibrationplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Pairwise synergy term: contributes {@code weight · min(x_a, x_b)} when both layers are active.
 */
public record InteractionTerm(
    @JsonProperty("layer_a")   CanonicalLayer layerA,
    @JsonProperty("layer_b")   CanonicalLayer layerB,
    @JsonProperty("weight")    double weight,
    @JsonProperty("rationale") String rationale
) {
    public InteractionTerm {
        Objects.requireNonNull(layerA, "layerA");
        Objects.requireNonNull(layerB, "layerB");
    }

    public boolean involves(CanonicalLayer layer) {
        return layerA == layer || layerB == layer;
    }

    /** Key used in certificates, e.g. {@code "(@u,@chain)"}. */
    public String key() {
        return "(" + layerA.symbol() + "," + layerB.symbol() + ")";
    }
}
