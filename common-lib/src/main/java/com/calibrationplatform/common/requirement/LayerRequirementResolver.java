package com.calibrationplatform.common.requirement;

import com.calibrationplatform.common.exception.CalibrationConfigException;
import com.calibrationplatform.common.model.CanonicalLayer;
import com.calibrationplatform.common.model.MethodRole;
import com.calibrationplatform.common.registry.LayerWaiver;
import com.calibrationplatform.common.registry.MethodDeclaration;
import com.calibrationplatform.common.registry.MethodRegistry;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Decides which layers a method is calibrated on.
 *
 * <p>No layer is ever skipped silently: a declared method that leaves out a required
 * layer must carry an approved waiver for it, and {@code @b} can never be waived.
 * An undeclared method is calibrated on exactly its role's required set.
 * A declaration with no {@code active_layers} inherits its role's required set.
 */
public final class LayerRequirementResolver {

    private final LayerRequirementProfile profile;

    public LayerRequirementResolver(LayerRequirementProfile profile) {
        this.profile = profile;
    }

    public Set<CanonicalLayer> requiredLayers(MethodRole role) {
        return profile.requiredFor(role);
    }

    /**
     * Effective active layers for a method.
     *
     * @param role        the subject's role
     * @param declaration the method's declaration, or {@code null} when undeclared
     * @return canonically ordered, mutable copy
     */
    public EnumSet<CanonicalLayer> activeLayers(MethodRole role, MethodDeclaration declaration) {
        if (declaration == null || declaration.activeLayers().isEmpty()) {
            return EnumSet.copyOf(profile.requiredFor(role));
        }
        return declaration.orderedActiveLayers();
    }

    /**
     * Required layers minus those the declaration waives with approval. These are
     * the layers a certificate must have evaluated to count as complete.
     */
    public EnumSet<CanonicalLayer> enforcedLayers(MethodRole role, MethodDeclaration declaration) {
        EnumSet<CanonicalLayer> enforced = EnumSet.noneOf(CanonicalLayer.class);
        enforced.addAll(profile.requiredFor(role));
        if (declaration != null) {
            declaration.waivers().forEach((layer, waiver) -> {
                if (layer != CanonicalLayer.BASE && waiver.isApproved()) enforced.remove(layer);
            });
        }
        return enforced;
    }

    /**
     * Validates one declaration.
     *
     * @return human-readable violations, empty when the declaration is acceptable
     */
    public List<String> violations(MethodDeclaration declaration) {
        List<String> problems = new ArrayList<>();
        EnumSet<CanonicalLayer> active = activeLayers(declaration.role(), declaration);
        for (CanonicalLayer layer : profile.requiredFor(declaration.role())) {
            if (active.contains(layer)) continue;
            if (layer == CanonicalLayer.BASE) {
                problems.add(declaration.methodId() + ": " + layer.symbol() + " cannot be waived");
                continue;
            }
            LayerWaiver waiver = declaration.waivers().get(layer);
            if (waiver == null) {
                problems.add(declaration.methodId() + ": required layer " + layer.symbol()
                    + " missing for role " + declaration.role().key() + " with no waiver");
            } else if (!waiver.isApproved()) {
                problems.add(declaration.methodId() + ": waiver for " + layer.symbol()
                    + " lacks justification or approver");
            }
        }
        return problems;
    }

    /**
     * Validates every declaration in the registry.
     *
     * @throws CalibrationConfigException listing all violations at once
     */
    public void validate(MethodRegistry registry) {
        List<String> problems = new ArrayList<>();
        for (MethodDeclaration d : registry.all()) {
            problems.addAll(violations(d));
        }
        if (!problems.isEmpty()) {
            throw new CalibrationConfigException("requirements", String.join("; ", problems));
        }
    }
}
