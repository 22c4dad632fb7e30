package com.calibrationplatform.common.requirement;

import com.calibrationplatform.common.exception.CalibrationConfigException;
import com.calibrationplatform.common.model.CanonicalLayer;
import com.calibrationplatform.common.model.MethodRole;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.calibrationplatform.common.model.CanonicalLayer.*;

/**
 * Role → mandatory layer set.
 *
 * <h3>Default catalogue</h3>
 * <pre>
 *   analyzer                               @b @chain @u @q @d @p @C @m
 *   processor, ingest, structure, extract  @b @chain @u @m
 *   aggregate                              @b @chain @d @p @C @m
 *   report                                 @b @chain @C @m
 *   utility, orchestrator, meta, transform @b @chain @m
 * </pre>
 *
 * <p>Every role must be catalogued and every set must contain {@code @b}.
 */
public final class LayerRequirementProfile {

    private final Map<MethodRole, Set<CanonicalLayer>> required;

    public LayerRequirementProfile(Map<MethodRole, ? extends Set<CanonicalLayer>> required) {
        EnumMap<MethodRole, Set<CanonicalLayer>> copy = new EnumMap<>(MethodRole.class);
        for (MethodRole role : MethodRole.values()) {
            Set<CanonicalLayer> layers = required.get(role);
            if (layers == null || layers.isEmpty()) {
                throw new CalibrationConfigException("requirements", "role not catalogued: " + role.key());
            }
            if (!layers.contains(BASE)) {
                throw new CalibrationConfigException("requirements",
                    "role " + role.key() + " must require " + BASE.symbol());
            }
            copy.put(role, Collections.unmodifiableSet(EnumSet.copyOf(layers)));
        }
        this.required = Collections.unmodifiableMap(copy);
    }

    public static LayerRequirementProfile defaults() {
        Map<MethodRole, Set<CanonicalLayer>> m = new EnumMap<>(MethodRole.class);
        m.put(MethodRole.ANALYZER, EnumSet.allOf(CanonicalLayer.class));
        for (MethodRole r : EnumSet.of(MethodRole.PROCESSOR, MethodRole.INGEST,
                MethodRole.STRUCTURE, MethodRole.EXTRACT)) {
            m.put(r, EnumSet.of(BASE, CHAIN, UNIT, META));
        }
        m.put(MethodRole.AGGREGATE, EnumSet.of(BASE, CHAIN, DIMENSION, POLICY, CONGRUENCE, META));
        m.put(MethodRole.REPORT, EnumSet.of(BASE, CHAIN, CONGRUENCE, META));
        for (MethodRole r : EnumSet.of(MethodRole.UTILITY, MethodRole.ORCHESTRATOR,
                MethodRole.META, MethodRole.TRANSFORM)) {
            m.put(r, EnumSet.of(BASE, CHAIN, META));
        }
        return new LayerRequirementProfile(m);
    }

    /** Unmodifiable, canonically ordered. */
    public Set<CanonicalLayer> requiredFor(MethodRole role) {
        return required.get(role);
    }

    public Map<MethodRole, Set<CanonicalLayer>> asMap() {
        return required;
    }
}
