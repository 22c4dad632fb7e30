package com.calibrationplatform.calibration.config;

import com.calibrationplatform.calibration.config.CalibrationConfigDocument.CompatibilityDocument;
import com.calibrationplatform.calibration.config.CalibrationConfigDocument.DecisionDocument;
import com.calibrationplatform.calibration.config.CalibrationConfigDocument.FusionDocument;
import com.calibrationplatform.calibration.config.CalibrationConfigDocument.InteractionDocument;
import com.calibrationplatform.calibration.config.CalibrationConfigDocument.MethodDocument;
import com.calibrationplatform.calibration.config.CalibrationConfigDocument.UnitDocument;
import com.calibrationplatform.calibration.config.CalibrationConfigDocument.WaiverDocument;
import com.calibrationplatform.common.config.CalibrationConfiguration;
import com.calibrationplatform.common.config.ContextDomain;
import com.calibrationplatform.common.config.DecisionPolicy;
import com.calibrationplatform.common.config.LayerRubric;
import com.calibrationplatform.common.config.LayerRubric.UnitFunction;
import com.calibrationplatform.common.config.LayerRubric.UnitFunctionKind;
import com.calibrationplatform.common.config.LayerRubric.UnitRubric;
import com.calibrationplatform.common.exception.CalibrationConfigException;
import com.calibrationplatform.common.fusion.FusionConfiguration;
import com.calibrationplatform.common.model.CanonicalLayer;
import com.calibrationplatform.common.model.CompatibilityTier;
import com.calibrationplatform.common.model.InteractionTerm;
import com.calibrationplatform.common.model.MethodRole;
import com.calibrationplatform.common.registry.CompatibilityDeclaration;
import com.calibrationplatform.common.registry.LayerWaiver;
import com.calibrationplatform.common.registry.MethodDeclaration;
import com.calibrationplatform.common.registry.MethodRegistry;
import com.calibrationplatform.common.requirement.LayerRequirementProfile;
import com.calibrationplatform.common.validation.AntiUniversalityValidator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads {@code calibration-config.json} and converts it into a validated
 * {@link CalibrationConfiguration}.
 *
 * <h3>Defaults</h3>
 * <ul>
 *   <li>{@code fusion.default} applies to every role without its own entry</li>
 *   <li>absent {@code requirements} → the built-in role catalogue</li>
 *   <li>each absent {@code rubric} section → that section's built-in values;
 *       a present section overrides field by field</li>
 *   <li>absent {@code decision} fields → built-in decision policy values</li>
 * </ul>
 * Every problem surfaces as {@link CalibrationConfigException}; nothing is defaulted
 * silently when a value is present but malformed.
 */
public class CalibrationConfigurationLoader {

    private static final Logger log = LoggerFactory.getLogger(CalibrationConfigurationLoader.class);

    static final String DEFAULT_FUSION_KEY = "default";

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    public CalibrationConfigurationLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
    }

    public CalibrationConfiguration load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new CalibrationConfigException("load", "configuration not found: " + location);
        }
        CalibrationConfigDocument document;
        try (InputStream in = resource.getInputStream()) {
            document = objectMapper.readValue(in, CalibrationConfigDocument.class);
        } catch (IOException e) {
            if (e.getCause() instanceof CalibrationConfigException cce) throw cce;
            throw new CalibrationConfigException("load", "cannot parse " + location + ": " + e.getMessage(), e);
        }
        log.info("[CalibrationConfig] parsed location={} version={}", location, document.version());
        return convert(document, location);
    }

    public CalibrationConfiguration convert(CalibrationConfigDocument doc, String source) {
        if (doc.version() == null || doc.version().isBlank()) {
            throw new CalibrationConfigException("load", "version is required");
        }
        ContextDomain domain = doc.domain() == null ? new ContextDomain(List.of(), List.of(), List.of()) : doc.domain();
        if (domain.isEmpty()) {
            log.warn("[CalibrationConfig] source={} declares no context domain; anti-universality has nothing to check",
                source);
        }
        try {
            return new CalibrationConfiguration(
                doc.version(),
                fusion(doc.fusion(), source, doc.version()),
                requirements(doc.requirements()),
                rubric(doc.rubric()),
                new MethodRegistry(methods(doc.methods())),
                domain,
                decision(doc.decision()),
                doc.antiUniversalityThreshold() == null
                    ? AntiUniversalityValidator.DEFAULT_THRESHOLD
                    : doc.antiUniversalityThreshold());
        } catch (IllegalArgumentException e) {
            throw new CalibrationConfigException("load", e.getMessage(), e);
        }
    }

    // ── fusion ────────────────────────────────────────────────────────────

    private Map<MethodRole, FusionConfiguration> fusion(Map<String, FusionDocument> docs,
                                                        String source, String version) {
        if (docs == null || docs.isEmpty()) {
            throw new CalibrationConfigException("fusion", "no fusion weights configured");
        }
        Set<String> known = new HashSet<>();
        known.add(DEFAULT_FUSION_KEY);
        Map<MethodRole, FusionConfiguration> out = new EnumMap<>(MethodRole.class);
        for (MethodRole role : MethodRole.values()) {
            known.add(role.key());
            FusionDocument doc = docs.containsKey(role.key()) ? docs.get(role.key()) : docs.get(DEFAULT_FUSION_KEY);
            if (doc == null) {
                throw new CalibrationConfigException("fusion", "no weights for role " + role.key() + " and no default");
            }
            out.put(role, fusionFor(role, doc, source, version));
        }
        for (String key : docs.keySet()) {
            if (!known.contains(key)) {
                throw new CalibrationConfigException("fusion", "unknown role key: " + key);
            }
        }
        return out;
    }

    private static FusionConfiguration fusionFor(MethodRole role, FusionDocument doc, String source, String version) {
        Map<CanonicalLayer, Double> linear = new EnumMap<>(CanonicalLayer.class);
        if (doc.linear() != null) {
            doc.linear().forEach((symbol, w) -> linear.put(CanonicalLayer.fromSymbol(symbol), w));
        }
        List<InteractionTerm> terms = new ArrayList<>();
        if (doc.interactions() != null) {
            for (InteractionDocument it : doc.interactions()) {
                if (it.layers() == null || it.layers().size() != 2) {
                    throw new CalibrationConfigException("fusion." + role.key(),
                        "interaction must name exactly two layers: " + it.layers());
                }
                if (it.weight() == null) {
                    throw new CalibrationConfigException("fusion." + role.key(),
                        "interaction " + it.layers() + " has no weight");
                }
                terms.add(new InteractionTerm(CanonicalLayer.fromSymbol(it.layers().get(0)),
                    CanonicalLayer.fromSymbol(it.layers().get(1)), it.weight(), it.rationale()));
            }
        }
        return new FusionConfiguration(role, linear, terms,
            doc.source() == null ? source : doc.source(),
            doc.version() == null ? version : doc.version());
    }

    // ── requirements ──────────────────────────────────────────────────────

    private static LayerRequirementProfile requirements(Map<String, List<String>> docs) {
        if (docs == null) return LayerRequirementProfile.defaults();
        Map<MethodRole, Set<CanonicalLayer>> map = new EnumMap<>(MethodRole.class);
        docs.forEach((role, symbols) -> map.put(MethodRole.fromKey(role), layers(symbols)));
        return new LayerRequirementProfile(map);
    }

    private static Set<CanonicalLayer> layers(List<String> symbols) {
        Set<CanonicalLayer> out = EnumSet.noneOf(CanonicalLayer.class);
        if (symbols != null) symbols.forEach(s -> out.add(CanonicalLayer.fromSymbol(s)));
        return out;
    }

    // ── rubric ────────────────────────────────────────────────────────────

    private LayerRubric rubric(JsonNode node) {
        LayerRubric defaults = LayerRubric.defaults();
        if (node == null || node.isNull()) return defaults;
        return new LayerRubric(
            section(node, "base", defaults.base(), LayerRubric.BaseRubric.class),
            section(node, "chain", defaults.chain(), LayerRubric.ChainRubric.class),
            unit(node.get("unit"), defaults.unit()),
            section(node, "contextual", defaults.contextual(), LayerRubric.ContextualRubric.class),
            section(node, "congruence", defaults.congruence(), LayerRubric.CongruenceRubric.class),
            section(node, "meta", defaults.meta(), LayerRubric.MetaRubric.class));
    }

    private <T> T section(JsonNode rubric, String name, T defaults, Class<T> type) {
        JsonNode override = rubric.get(name);
        if (override == null || override.isNull()) return defaults;
        if (!override.isObject()) {
            throw new CalibrationConfigException("rubric." + name, "section must be an object");
        }
        ObjectNode merged = objectMapper.valueToTree(defaults);
        merged.setAll((ObjectNode) override);
        try {
            return objectMapper.treeToValue(merged, type);
        } catch (JsonProcessingException e) {
            if (e.getCause() instanceof CalibrationConfigException cce) throw cce;
            throw new CalibrationConfigException("rubric." + name, e.getOriginalMessage(), e);
        }
    }

    private UnitRubric unit(JsonNode node, UnitRubric defaults) {
        if (node == null || node.isNull()) return defaults;
        UnitDocument doc;
        try {
            doc = objectMapper.treeToValue(node, UnitDocument.class);
        } catch (JsonProcessingException e) {
            throw new CalibrationConfigException("rubric.unit", e.getOriginalMessage(), e);
        }
        Map<MethodRole, UnitFunction> functions = new EnumMap<>(MethodRole.class);
        if (doc.functions() == null) {
            functions.putAll(defaults.functions());
        } else {
            doc.functions().forEach((role, fn) -> functions.put(MethodRole.fromKey(role), unitFunction(role, fn)));
        }
        return new UnitRubric(functions,
            doc.minStructuralCompliance() == null ? defaults.minStructuralCompliance() : doc.minStructuralCompliance(),
            doc.requireIndicatorMatrix() == null ? defaults.requireIndicatorMatrix() : doc.requireIndicatorMatrix(),
            doc.requirePpiPresence() == null ? defaults.requirePpiPresence() : doc.requirePpiPresence());
    }

    private static UnitFunction unitFunction(String role, JsonNode fn) {
        String kind = fn.path("kind").asText("");
        return switch (UnitFunctionKind.valueOf(kind.toUpperCase(Locale.ROOT))) {
            case IDENTITY -> UnitFunction.identity();
            case PIECEWISE -> UnitFunction.piecewise(required(role, fn, "abort"), required(role, fn, "saturation"),
                required(role, fn, "slope"), required(role, fn, "intercept"));
            case SIGMOID -> UnitFunction.sigmoid(required(role, fn, "k"), required(role, fn, "x0"));
            case CONSTANT -> UnitFunction.constant(required(role, fn, "constant"));
        };
    }

    private static double required(String role, JsonNode fn, String field) {
        JsonNode v = fn.get(field);
        if (v == null || !v.isNumber()) {
            throw new CalibrationConfigException("rubric.unit." + role, "numeric field '" + field + "' is required");
        }
        return v.asDouble();
    }

    // ── decision ──────────────────────────────────────────────────────────

    private static DecisionPolicy decision(DecisionDocument doc) {
        DecisionPolicy defaults = DecisionPolicy.defaults();
        if (doc == null) return defaults;
        Map<MethodRole, Double> thresholds = new EnumMap<>(MethodRole.class);
        if (doc.roleThresholds() == null) {
            thresholds.putAll(defaults.roleThresholds());
        } else {
            doc.roleThresholds().forEach((role, t) -> thresholds.put(MethodRole.fromKey(role), t));
        }
        return new DecisionPolicy(
            doc.defaultThreshold() == null ? defaults.defaultThreshold() : doc.defaultThreshold(),
            thresholds,
            doc.conditionalTolerance() == null ? defaults.conditionalTolerance() : doc.conditionalTolerance(),
            doc.attributionFloor() == null ? defaults.attributionFloor() : doc.attributionFloor(),
            doc.planPassRatio() == null ? defaults.planPassRatio() : doc.planPassRatio());
    }

    // ── methods ───────────────────────────────────────────────────────────

    private static List<MethodDeclaration> methods(List<MethodDocument> docs) {
        List<MethodDeclaration> out = new ArrayList<>();
        if (docs == null) return out;
        for (MethodDocument d : docs) {
            if (d.methodId() == null || d.role() == null) {
                throw new CalibrationConfigException("methods", "method_id and role are required: " + d);
            }
            Map<CanonicalLayer, LayerWaiver> waivers = new EnumMap<>(CanonicalLayer.class);
            if (d.waivers() != null) {
                for (Map.Entry<String, WaiverDocument> w : d.waivers().entrySet()) {
                    waivers.put(CanonicalLayer.fromSymbol(w.getKey()),
                        new LayerWaiver(w.getValue().justification(), w.getValue().approvedBy()));
                }
            }
            out.add(new MethodDeclaration(
                d.methodId(),
                MethodRole.fromKey(d.role()),
                d.version(),
                layers(d.activeLayers()),
                waivers,
                compatibility(d.compatibility()),
                d.outputRange(),
                d.transformableTo() == null ? Set.of() : new HashSet<>(d.transformableTo()),
                d.conceptTags() == null ? Set.of() : new HashSet<>(d.conceptTags()),
                d.fusionRequirements() == null ? Set.of() : new HashSet<>(d.fusionRequirements()),
                d.threshold()));
        }
        return out;
    }

    private static CompatibilityDeclaration compatibility(CompatibilityDocument doc) {
        if (doc == null) return CompatibilityDeclaration.none();
        return new CompatibilityDeclaration(tiers(doc.questions()), tiers(doc.dimensions()), tiers(doc.policyAreas()));
    }

    private static Map<String, CompatibilityTier> tiers(Map<String, String> raw) {
        Map<String, CompatibilityTier> out = new HashMap<>();
        if (raw != null) raw.forEach((key, tier) -> out.put(key, CompatibilityTier.fromKey(tier)));
        return out;
    }
}
