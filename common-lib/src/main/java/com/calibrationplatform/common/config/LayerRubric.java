package com.calibrationplatform.common.config;

import com.calibrationplatform.common.exception.CalibrationConfigException;
import com.calibrationplatform.common.model.CompatibilityTier;
import com.calibrationplatform.common.model.MethodRole;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Every tier value, threshold and sub-weight the layer evaluators use.
 *
 * <p>Each nested rubric validates itself at construction, so a loaded
 * {@code LayerRubric} is always internally consistent. Evaluators never carry
 * literals of their own.
 */
public record LayerRubric(
    @JsonProperty("base")       BaseRubric base,
    @JsonProperty("chain")      ChainRubric chain,
    @JsonProperty("unit")       UnitRubric unit,
    @JsonProperty("contextual") ContextualRubric contextual,
    @JsonProperty("congruence") CongruenceRubric congruence,
    @JsonProperty("meta")       MetaRubric meta
) {
    static final double TOLERANCE = 1e-6;

    public static LayerRubric defaults() {
        return new LayerRubric(
            BaseRubric.defaults(), ChainRubric.defaults(), UnitRubric.defaults(),
            ContextualRubric.defaults(), CongruenceRubric.defaults(), MetaRubric.defaults());
    }

    static void requireUnit(String section, String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new CalibrationConfigException(section, name + " must be in [0,1], got " + value);
        }
    }

    // ── BASE ──────────────────────────────────────────────────────────────

    /**
     * <pre>
     *   x_@b = w_th·b_theory + w_imp·b_impl + w_dep·b_deploy
     * </pre>
     * {@code pendingScore} and {@code noneScore} replace all three components when the
     * registry has no computed entry.
     */
    public record BaseRubric(
        @JsonProperty("w_theory")      double theoryWeight,
        @JsonProperty("w_impl")        double implWeight,
        @JsonProperty("w_deploy")      double deployWeight,
        @JsonProperty("pending_score") double pendingScore,
        @JsonProperty("none_score")    double noneScore
    ) {
        public BaseRubric {
            requireUnit("rubric.base", "w_theory", theoryWeight);
            requireUnit("rubric.base", "w_impl", implWeight);
            requireUnit("rubric.base", "w_deploy", deployWeight);
            requireUnit("rubric.base", "pending_score", pendingScore);
            requireUnit("rubric.base", "none_score", noneScore);
            double sum = theoryWeight + implWeight + deployWeight;
            if (Math.abs(sum - 1.0) > TOLERANCE) {
                throw new CalibrationConfigException("rubric.base",
                    "component weights must sum to 1.0, got " + sum);
            }
        }

        public static BaseRubric defaults() {
            return new BaseRubric(0.4, 0.35, 0.25, 0.5, 0.3);
        }
    }

    // ── CHAIN ─────────────────────────────────────────────────────────────

    /** Five wiring tiers, which must be non-decreasing from hard mismatch to clean. */
    public record ChainRubric(
        @JsonProperty("hard_mismatch")      double hardMismatch,
        @JsonProperty("missing_beneficial") double missingBeneficial,
        @JsonProperty("schema_deviation")   double schemaDeviation,
        @JsonProperty("pass_with_warnings") double passWithWarnings,
        @JsonProperty("clean")              double clean
    ) {
        public ChainRubric {
            double[] tiers = {hardMismatch, missingBeneficial, schemaDeviation, passWithWarnings, clean};
            for (int i = 0; i < tiers.length; i++) {
                requireUnit("rubric.chain", "tier[" + i + "]", tiers[i]);
                if (i > 0 && tiers[i] < tiers[i - 1]) {
                    throw new CalibrationConfigException("rubric.chain",
                        "tiers must be non-decreasing, tier[" + i + "]=" + tiers[i]
                            + " < tier[" + (i - 1) + "]=" + tiers[i - 1]);
                }
            }
        }

        public static ChainRubric defaults() {
            return new ChainRubric(0.0, 0.3, 0.6, 0.8, 1.0);
        }
    }

    // ── UNIT ──────────────────────────────────────────────────────────────

    /**
     * Unit-quality response curves per role plus the three hard gates.
     * Roles without an entry are insensitive to unit quality ({@code g(U) = 1}).
     */
    public record UnitRubric(
        @JsonProperty("functions")                 Map<MethodRole, UnitFunction> functions,
        @JsonProperty("min_structural_compliance") double minStructuralCompliance,
        @JsonProperty("require_indicator_matrix")  boolean requireIndicatorMatrix,
        @JsonProperty("require_ppi_presence")      boolean requirePpiPresence
    ) {
        public UnitRubric {
            requireUnit("rubric.unit", "min_structural_compliance", minStructuralCompliance);
            EnumMap<MethodRole, UnitFunction> copy = new EnumMap<>(MethodRole.class);
            if (functions != null) copy.putAll(functions);
            functions = Collections.unmodifiableMap(copy);
        }

        public UnitFunction functionFor(MethodRole role) {
            return functions.getOrDefault(role, UnitFunction.constant(1.0));
        }

        public static UnitRubric defaults() {
            Map<MethodRole, UnitFunction> fns = new EnumMap<>(MethodRole.class);
            fns.put(MethodRole.INGEST, UnitFunction.identity());
            fns.put(MethodRole.PROCESSOR, UnitFunction.identity());
            fns.put(MethodRole.STRUCTURE, UnitFunction.piecewise(0.3, 0.8, 2.0, -0.6));
            fns.put(MethodRole.EXTRACT, UnitFunction.piecewise(0.3, 0.8, 2.0, -0.6));
            fns.put(MethodRole.ANALYZER, UnitFunction.sigmoid(5.0, 0.3));
            return new UnitRubric(fns, 0.5, true, true);
        }
    }

    /** Shape of a unit-quality response curve. */
    public enum UnitFunctionKind { IDENTITY, PIECEWISE, SIGMOID, CONSTANT }

    /**
     * A monotone non-decreasing map {@code g: [0,1] → [0,1]}.
     *
     * <pre>
     *   IDENTITY   g(U) = U
     *   PIECEWISE  g(U) = 0                    U &lt; abort
     *                     slope·U + intercept  abort ≤ U &lt; saturation
     *                     1                    U ≥ saturation
     *   SIGMOID    g(U) = max(0, 1 − e^(−k(U − x0)))
     *   CONSTANT   g(U) = constant
     * </pre>
     */
    public record UnitFunction(
        @JsonProperty("kind")       UnitFunctionKind kind,
        @JsonProperty("abort")      double abort,
        @JsonProperty("saturation") double saturation,
        @JsonProperty("slope")      double slope,
        @JsonProperty("intercept")  double intercept,
        @JsonProperty("k")          double k,
        @JsonProperty("x0")         double x0,
        @JsonProperty("constant")   double constant
    ) {
        public UnitFunction {
            if (kind == null) {
                throw new CalibrationConfigException("rubric.unit", "function kind is required");
            }
            switch (kind) {
                case PIECEWISE -> validateRamp(abort, saturation, slope, intercept);
                case SIGMOID -> {
                    if (!(k > 0.0)) {
                        throw new CalibrationConfigException("rubric.unit", "sigmoid k must be > 0, got " + k);
                    }
                    requireUnit("rubric.unit", "sigmoid x0", x0);
                }
                case CONSTANT -> requireUnit("rubric.unit", "constant", constant);
                case IDENTITY -> { }
            }
        }

        private static void validateRamp(double abort, double saturation, double slope, double intercept) {
            requireUnit("rubric.unit", "abort", abort);
            requireUnit("rubric.unit", "saturation", saturation);
            if (abort >= saturation) {
                throw new CalibrationConfigException("rubric.unit",
                    "abort (" + abort + ") must be below saturation (" + saturation + ")");
            }
            if (slope < 0.0) {
                throw new CalibrationConfigException("rubric.unit", "slope must be >= 0, got " + slope);
            }
            double atAbort = slope * abort + intercept;
            double atSaturation = slope * saturation + intercept;
            if (atAbort < -TOLERANCE || atSaturation > 1.0 + TOLERANCE) {
                throw new CalibrationConfigException("rubric.unit", String.format(
                    "ramp leaves [0,1]: g(%.3f)=%.4f g(%.3f)=%.4f", abort, atAbort, saturation, atSaturation));
            }
        }

        public static UnitFunction identity() {
            return new UnitFunction(UnitFunctionKind.IDENTITY, 0, 0, 0, 0, 0, 0, 0);
        }

        public static UnitFunction piecewise(double abort, double saturation, double slope, double intercept) {
            return new UnitFunction(UnitFunctionKind.PIECEWISE, abort, saturation, slope, intercept, 0, 0, 0);
        }

        public static UnitFunction sigmoid(double k, double x0) {
            return new UnitFunction(UnitFunctionKind.SIGMOID, 0, 0, 0, 0, k, x0, 0);
        }

        public static UnitFunction constant(double value) {
            return new UnitFunction(UnitFunctionKind.CONSTANT, 0, 0, 0, 0, 0, 0, value);
        }

        public double apply(double u) {
            double g = switch (kind) {
                case IDENTITY -> u;
                case PIECEWISE -> {
                    if (u < abort) yield 0.0;
                    if (u >= saturation) yield 1.0;
                    yield slope * u + intercept;
                }
                case SIGMOID -> Math.max(0.0, 1.0 - Math.exp(-k * (u - x0)));
                case CONSTANT -> constant;
            };
            // float noise at the ramp ends only
            return Math.max(0.0, Math.min(1.0, g));
        }

        public String formula() {
            return switch (kind) {
                case IDENTITY -> "g(U) = U";
                case PIECEWISE -> String.format(
                    "g(U) = 0 if U<%s; %s·U%+.4f if U<%s; 1 otherwise", abort, slope, intercept, saturation);
                case SIGMOID -> String.format("g(U) = max(0, 1 - e^(-%s·(U - %s)))", k, x0);
                case CONSTANT -> "g(U) = " + constant;
            };
        }
    }

    // ── QUESTION / DIMENSION / POLICY ─────────────────────────────────────

    public record ContextualRubric(
        @JsonProperty("primary")      double primary,
        @JsonProperty("secondary")    double secondary,
        @JsonProperty("compatible")   double compatible,
        @JsonProperty("undeclared")   double undeclared,
        @JsonProperty("incompatible") double incompatible
    ) {
        public ContextualRubric {
            requireUnit("rubric.contextual", "primary", primary);
            requireUnit("rubric.contextual", "secondary", secondary);
            requireUnit("rubric.contextual", "compatible", compatible);
            requireUnit("rubric.contextual", "undeclared", undeclared);
            requireUnit("rubric.contextual", "incompatible", incompatible);
        }

        public static ContextualRubric defaults() {
            return new ContextualRubric(1.0, 0.7, 0.3, 0.1, 0.0);
        }

        public double score(CompatibilityTier tier) {
            return switch (tier) {
                case PRIMARY -> primary;
                case SECONDARY -> secondary;
                case COMPATIBLE -> compatible;
                case UNDECLARED -> undeclared;
                case INCOMPATIBLE -> incompatible;
            };
        }
    }

    // ── CONGRUENCE ────────────────────────────────────────────────────────

    public record CongruenceRubric(
        @JsonProperty("scale_identical")   double scaleIdentical,
        @JsonProperty("scale_convertible") double scaleConvertible,
        @JsonProperty("scale_mismatch")    double scaleMismatch,
        @JsonProperty("fusion_complete")   double fusionComplete,
        @JsonProperty("fusion_partial")    double fusionPartial,
        @JsonProperty("fusion_invalid")    double fusionInvalid,
        @JsonProperty("recognized_rules")  Set<String> recognizedRules
    ) {
        public CongruenceRubric {
            requireUnit("rubric.congruence", "scale_identical", scaleIdentical);
            requireUnit("rubric.congruence", "scale_convertible", scaleConvertible);
            requireUnit("rubric.congruence", "scale_mismatch", scaleMismatch);
            requireUnit("rubric.congruence", "fusion_complete", fusionComplete);
            requireUnit("rubric.congruence", "fusion_partial", fusionPartial);
            requireUnit("rubric.congruence", "fusion_invalid", fusionInvalid);
            recognizedRules = recognizedRules == null ? Set.of()
                : Collections.unmodifiableSortedSet(new TreeSet<>(recognizedRules));
        }

        public static CongruenceRubric defaults() {
            return new CongruenceRubric(1.0, 0.8, 0.0, 1.0, 0.5, 0.0,
                Set.of("weighted_average", "max", "min", "product", "custom"));
        }
    }

    // ── META ──────────────────────────────────────────────────────────────

    /**
     * <pre>
     *   x_@m = w_transp·m_transp + w_gov·m_gov + w_cost·m_cost
     *   m_cost = min(runtimeTier, memoryTier)
     * </pre>
     * Tier lists are indexed by the number of satisfied conditions (0..3).
     */
    public record MetaRubric(
        @JsonProperty("w_transparency")      double transparencyWeight,
        @JsonProperty("w_governance")        double governanceWeight,
        @JsonProperty("w_cost")              double costWeight,
        @JsonProperty("transparency_tiers")  List<Double> transparencyTiers,
        @JsonProperty("governance_tiers")    List<Double> governanceTiers,
        @JsonProperty("fast_runtime_ms")       double fastRuntimeMs,
        @JsonProperty("acceptable_runtime_ms") double acceptableRuntimeMs,
        @JsonProperty("normal_memory_mb")      double normalMemoryMb,
        @JsonProperty("high_memory_mb")        double highMemoryMb,
        @JsonProperty("cost_fast")           double costFast,
        @JsonProperty("cost_acceptable")     double costAcceptable,
        @JsonProperty("cost_slow")           double costSlow
    ) {
        public MetaRubric {
            requireUnit("rubric.meta", "w_transparency", transparencyWeight);
            requireUnit("rubric.meta", "w_governance", governanceWeight);
            requireUnit("rubric.meta", "w_cost", costWeight);
            double sum = transparencyWeight + governanceWeight + costWeight;
            if (Math.abs(sum - 1.0) > TOLERANCE) {
                throw new CalibrationConfigException("rubric.meta",
                    "sub-weights must sum to 1.0, got " + sum);
            }
            transparencyTiers = validateTiers("transparency_tiers", transparencyTiers);
            governanceTiers = validateTiers("governance_tiers", governanceTiers);
            if (fastRuntimeMs > acceptableRuntimeMs || normalMemoryMb > highMemoryMb) {
                throw new CalibrationConfigException("rubric.meta", "cost thresholds must be ascending");
            }
            requireUnit("rubric.meta", "cost_fast", costFast);
            requireUnit("rubric.meta", "cost_acceptable", costAcceptable);
            requireUnit("rubric.meta", "cost_slow", costSlow);
        }

        private static List<Double> validateTiers(String name, List<Double> tiers) {
            if (tiers == null || tiers.size() != 4) {
                throw new CalibrationConfigException("rubric.meta", name + " needs exactly 4 values (0..3 conditions)");
            }
            for (int i = 0; i < tiers.size(); i++) {
                requireUnit("rubric.meta", name + "[" + i + "]", tiers.get(i));
            }
            return List.copyOf(tiers);
        }

        public static MetaRubric defaults() {
            return new MetaRubric(0.5, 0.4, 0.1,
                List.of(0.0, 0.4, 0.7, 1.0),
                List.of(0.0, 0.33, 0.66, 1.0),
                1000.0, 5000.0, 512.0, 2048.0,
                1.0, 0.8, 0.5);
        }

        public double runtimeTier(double runtimeMs) {
            if (runtimeMs < fastRuntimeMs) return costFast;
            if (runtimeMs < acceptableRuntimeMs) return costAcceptable;
            return costSlow;
        }

        public double memoryTier(double memoryMb) {
            if (memoryMb <= normalMemoryMb) return costFast;
            if (memoryMb <= highMemoryMb) return costAcceptable;
            return costSlow;
        }
    }
}
