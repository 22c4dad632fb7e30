package com.calibrationplatform.common.fusion;

import com.calibrationplatform.common.model.CanonicalLayer;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One summand of the fused score, as recorded in the computation trace.
 *
 * @param input {@code x_l} for a linear term, {@code min(x_a, x_b)} for an interaction
 */
public record FusionTerm(
    @JsonProperty("kind")         Kind kind,
    @JsonProperty("key")          String key,
    @JsonProperty("layers")       List<CanonicalLayer> layers,
    @JsonProperty("weight")       double weight,
    @JsonProperty("input")        double input,
    @JsonProperty("contribution") double contribution
) {
    public enum Kind { LINEAR, INTERACTION }

    public FusionTerm {
        layers = List.copyOf(layers);
    }

    public static FusionTerm linear(CanonicalLayer layer, double weight, double x) {
        return new FusionTerm(Kind.LINEAR, layer.symbol(), List.of(layer), weight, x, weight * x);
    }

    public static FusionTerm interaction(String key, CanonicalLayer a, CanonicalLayer b,
                                         double weight, double min) {
        return new FusionTerm(Kind.INTERACTION, key, List.of(a, b), weight, min, weight * min);
    }

    public boolean involves(CanonicalLayer layer) {
        return layers.contains(layer);
    }

    /** e.g. {@code "0.150·0.900 = 0.135000"}. */
    public String trace() {
        String lhs = kind == Kind.LINEAR
            ? key
            : "min" + key;
        return String.format("%s: %.6f·%.6f = %.6f", lhs, weight, input, contribution);
    }
}
