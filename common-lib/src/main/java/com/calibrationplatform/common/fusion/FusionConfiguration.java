package com.calibrationplatform.common.fusion;

import com.calibrationplatform.common.exception.CalibrationConfigException;
import com.calibrationplatform.common.model.CanonicalLayer;
import com.calibrationplatform.common.model.InteractionTerm;
import com.calibrationplatform.common.model.MethodRole;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Linear and interaction weights for one role.
 *
 * <h3>Load-time validation</h3>
 * <ul>
 *   <li>every weight finite and ≥ 0</li>
 *   <li>interaction pairs over two distinct layers, each unordered pair at most once</li>
 *   <li>{@code 1 - }{@value #NORMALIZATION_TOLERANCE}{@code  ≤ Σ linear + Σ interaction ≤ 1}, the sum
 *       taken exactly and rounded once</li>
 * </ul>
 * The upper bound has no tolerance: a total above 1.0 could fuse to a score above 1.0.
 * Weights are never renormalized; a violation is a {@link CalibrationConfigException}.
 */
public record FusionConfiguration(
    @JsonProperty("role")         MethodRole role,
    @JsonProperty("linear")       Map<CanonicalLayer, Double> linearWeights,
    @JsonProperty("interactions") List<InteractionTerm> interactions,
    @JsonProperty("source")       String source,
    @JsonProperty("version")      String version
) {
    public static final double NORMALIZATION_TOLERANCE = 1e-6;

    public FusionConfiguration {
        Objects.requireNonNull(role, "role");
        String section = "fusion." + role.key();
        EnumMap<CanonicalLayer, Double> linear = new EnumMap<>(CanonicalLayer.class);
        if (linearWeights != null) linear.putAll(linearWeights);
        List<InteractionTerm> terms = interactions == null ? List.of() : List.copyOf(interactions);

        for (Map.Entry<CanonicalLayer, Double> e : linear.entrySet()) {
            requireWeight(section, e.getKey().symbol(), e.getValue());
        }
        Set<Set<CanonicalLayer>> seenPairs = new HashSet<>();
        for (InteractionTerm t : terms) {
            if (t.layerA() == t.layerB()) {
                throw new CalibrationConfigException(section,
                    "interaction pairs a layer with itself: " + t.key());
            }
            if (!seenPairs.add(EnumSet.of(t.layerA(), t.layerB()))) {
                throw new CalibrationConfigException(section, "duplicate interaction pair: " + t.key());
            }
            requireWeight(section, t.key(), t.weight());
        }
        double total = exactTotal(linear, terms);
        if (!isNormalized(total)) {
            throw new CalibrationConfigException(section, String.format(
                "weights must sum to within [1.0 - %s, 1.0], got %.9f (linear=%s interactions=%s)",
                NORMALIZATION_TOLERANCE, total, linear, describe(terms)));
        }
        linearWeights = Collections.unmodifiableMap(linear);
        interactions = terms;
        source = source == null ? "unspecified" : source;
        version = version == null ? "unspecified" : version;
    }

    private static void requireWeight(String section, String name, Double w) {
        if (w == null || !Double.isFinite(w) || w < 0.0) {
            throw new CalibrationConfigException(section, "weight " + name + " must be finite and >= 0, got " + w);
        }
    }

    private static double exactTotal(Map<CanonicalLayer, Double> linear, List<InteractionTerm> terms) {
        BigDecimal total = BigDecimal.ZERO;
        for (double w : linear.values()) total = total.add(new BigDecimal(w));
        for (InteractionTerm t : terms) total = total.add(new BigDecimal(t.weight()));
        return total.doubleValue();
    }

    /** Whether a weight total is acceptable; shared by load-time validation and certificate checks. */
    public static boolean isNormalized(double total) {
        return total <= 1.0 && total >= 1.0 - NORMALIZATION_TOLERANCE;
    }

    static String describe(List<InteractionTerm> terms) {
        StringBuilder sb = new StringBuilder("{");
        for (InteractionTerm t : terms) {
            if (sb.length() > 1) sb.append(", ");
            sb.append(t.key()).append('=').append(t.weight());
        }
        return sb.append('}').toString();
    }

    public double linearWeight(CanonicalLayer layer) {
        return linearWeights.getOrDefault(layer, 0.0);
    }

    /** Sum of all weights, as validated at construction. */
    public double totalWeight() {
        return exactTotal(linearWeights, interactions);
    }
}
