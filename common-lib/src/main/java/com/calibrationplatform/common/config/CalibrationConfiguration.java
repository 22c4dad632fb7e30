package com.calibrationplatform.common.config;

import com.calibrationplatform.common.digest.ContentHasher;
import com.calibrationplatform.common.exception.CalibrationConfigException;
import com.calibrationplatform.common.fusion.FusionConfiguration;
import com.calibrationplatform.common.model.MethodRole;
import com.calibrationplatform.common.requirement.LayerRequirementProfile;
import com.calibrationplatform.common.requirement.LayerRequirementResolver;
import com.calibrationplatform.common.registry.MethodRegistry;
import com.calibrationplatform.common.validation.AntiUniversalityValidator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The single, immutable set of calibration parameters shared by every calibration call.
 *
 * <h3>Construction validates, in order</h3>
 * <ol>
 *   <li>a fusion configuration exists for every role and is keyed by its own role</li>
 *   <li>every method declaration covers its role's required layers (or carries approved waivers)</li>
 *   <li>no declared method is universal over the context domain</li>
 * </ol>
 * Any failure is a {@link CalibrationConfigException}. On success the SHA-256 content
 * hash of the canonical parameter set is computed once and exposed via {@link #configHash()}.
 */
public final class CalibrationConfiguration {

    private final String version;
    private final Map<MethodRole, FusionConfiguration> fusion;
    private final LayerRequirementProfile requirements;
    private final LayerRubric rubric;
    private final MethodRegistry methods;
    private final ContextDomain domain;
    private final DecisionPolicy decisionPolicy;
    private final double antiUniversalityThreshold;
    private final String configHash;

    public CalibrationConfiguration(String version,
                                    Map<MethodRole, FusionConfiguration> fusion,
                                    LayerRequirementProfile requirements,
                                    LayerRubric rubric,
                                    MethodRegistry methods,
                                    ContextDomain domain,
                                    DecisionPolicy decisionPolicy,
                                    double antiUniversalityThreshold) {
        this.version = version;
        this.requirements = requirements;
        this.rubric = rubric;
        this.methods = methods;
        this.domain = domain;
        this.decisionPolicy = decisionPolicy;
        this.antiUniversalityThreshold = antiUniversalityThreshold;

        EnumMap<MethodRole, FusionConfiguration> byRole = new EnumMap<>(MethodRole.class);
        for (MethodRole role : MethodRole.values()) {
            FusionConfiguration fc = fusion.get(role);
            if (fc == null) {
                throw new CalibrationConfigException("fusion", "no fusion configuration for role " + role.key());
            }
            if (fc.role() != role) {
                throw new CalibrationConfigException("fusion",
                    "configuration registered under " + role.key() + " declares role " + fc.role().key());
            }
            byRole.put(role, fc);
        }
        this.fusion = Collections.unmodifiableMap(byRole);

        new LayerRequirementResolver(requirements).validate(methods);
        new AntiUniversalityValidator(rubric.contextual(), antiUniversalityThreshold).validate(methods, domain);

        this.configHash = ContentHasher.sha256(canonicalView());
    }

    private Map<String, Object> canonicalView() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("version", version);
        view.put("fusion", fusion);
        view.put("requirements", requirements.asMap());
        view.put("rubric", rubric);
        view.put("methods", new ArrayList<>(methods.all()));
        view.put("domain", domain);
        view.put("decision", decisionPolicy);
        view.put("anti_universality_threshold", antiUniversalityThreshold);
        return view;
    }

    public FusionConfiguration fusionFor(MethodRole role) {
        return fusion.get(role);
    }

    public LayerRequirementResolver resolver() {
        return new LayerRequirementResolver(requirements);
    }

    public String version()                                 { return version; }
    public Map<MethodRole, FusionConfiguration> fusion()    { return fusion; }
    public LayerRequirementProfile requirements()           { return requirements; }
    public LayerRubric rubric()                             { return rubric; }
    public MethodRegistry methods()                         { return methods; }
    public ContextDomain domain()                           { return domain; }
    public DecisionPolicy decisionPolicy()                  { return decisionPolicy; }
    public double antiUniversalityThreshold()               { return antiUniversalityThreshold; }
    public String configHash()                              { return configHash; }
}
