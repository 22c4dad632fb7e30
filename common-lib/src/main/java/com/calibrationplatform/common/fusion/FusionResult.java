package com.calibrationplatform.common.fusion;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * Output of a fusion run: the two partial sums, the final score, and every term
 * in evaluation order (linear terms in canonical layer order, then interactions
 * in configuration order).
 */
public record FusionResult(
    @JsonProperty("linear_sum")      double linearSum,
    @JsonProperty("interaction_sum") double interactionSum,
    @JsonProperty("final_score")     double finalScore,
    @JsonProperty("terms")           List<FusionTerm> terms
) {
    public FusionResult {
        terms = List.copyOf(terms);
    }

    public List<FusionTerm> linearTerms() {
        return terms.stream().filter(t -> t.kind() == FusionTerm.Kind.LINEAR).toList();
    }

    public List<FusionTerm> interactionTerms() {
        return terms.stream().filter(t -> t.kind() == FusionTerm.Kind.INTERACTION).toList();
    }

    /**
     * Re-adds the recorded terms. Bit-identical to {@link #finalScore()} for a result
     * produced by {@link ChoquetFusionOperator}.
     */
    public static double recompute(List<FusionTerm> terms) {
        return exactSum(terms);
    }

    /**
     * Σ weight·input computed without intermediate rounding, rounded once at the end.
     * The result is independent of term order and never exceeds the rounded exact sum
     * of the weights when every input is in [0,1]. NaN when any term is non-finite.
     */
    static double exactSum(List<FusionTerm> terms) {
        BigDecimal sum = BigDecimal.ZERO;
        for (FusionTerm t : terms) {
            if (!Double.isFinite(t.weight()) || !Double.isFinite(t.input())) return Double.NaN;
            sum = sum.add(new BigDecimal(t.weight()).multiply(new BigDecimal(t.input())));
        }
        return sum.doubleValue();
    }

    /** The single score bound used by the operator, the certificate checks and the verifier. */
    public static boolean isBounded(double score) {
        return score >= 0.0 && score <= 1.0;
    }
}
