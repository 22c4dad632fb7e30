package com.calibrationplatform.common.requirement;

import com.calibrationplatform.common.CalibrationFixtures;
import com.calibrationplatform.common.exception.CalibrationConfigException;
import com.calibrationplatform.common.model.CanonicalLayer;
import com.calibrationplatform.common.model.MethodRole;
import com.calibrationplatform.common.registry.LayerWaiver;
import com.calibrationplatform.common.registry.MethodDeclaration;
import com.calibrationplatform.common.registry.MethodRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.calibrationplatform.common.model.CanonicalLayer.*;
import static org.junit.jupiter.api.Assertions.*;

class LayerRequirementResolverTest {

    private final LayerRequirementResolver resolver = new LayerRequirementResolver(LayerRequirementProfile.defaults());

    private static MethodDeclaration declared(MethodRole role, Set<CanonicalLayer> active,
                                              Map<CanonicalLayer, LayerWaiver> waivers) {
        return new MethodDeclaration("m.Decl.run", role, "1", active, waivers, null, null, null, null, null, null);
    }

    // ── catalogue ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("default catalogue")
    class Catalogue {

        @Test
        @DisplayName("analyzer requires all eight layers")
        void analyzer() {
            assertEquals(EnumSet.allOf(CanonicalLayer.class), resolver.requiredLayers(MethodRole.ANALYZER));
        }

        @Test
        @DisplayName("document roles require @b @chain @u @m")
        void documentRoles() {
            for (MethodRole role : List.of(MethodRole.PROCESSOR, MethodRole.INGEST, MethodRole.STRUCTURE,
                    MethodRole.EXTRACT)) {
                assertEquals(EnumSet.of(BASE, CHAIN, UNIT, META), resolver.requiredLayers(role), role.key());
            }
        }

        @Test
        @DisplayName("aggregate and report")
        void aggregateAndReport() {
            assertEquals(EnumSet.of(BASE, CHAIN, DIMENSION, POLICY, CONGRUENCE, META),
                resolver.requiredLayers(MethodRole.AGGREGATE));
            assertEquals(EnumSet.of(BASE, CHAIN, CONGRUENCE, META), resolver.requiredLayers(MethodRole.REPORT));
        }

        @Test
        @DisplayName("every role requires @b")
        void baseAlwaysRequired() {
            for (MethodRole role : MethodRole.values()) {
                assertTrue(resolver.requiredLayers(role).contains(BASE), role.key());
            }
        }

        @Test
        @DisplayName("a catalogue missing a role or omitting @b is rejected")
        void invalidCatalogue() {
            Map<MethodRole, Set<CanonicalLayer>> partial = new EnumMap<>(MethodRole.class);
            partial.put(MethodRole.ANALYZER, EnumSet.allOf(CanonicalLayer.class));
            assertThrows(CalibrationConfigException.class, () -> new LayerRequirementProfile(partial));

            Map<MethodRole, Set<CanonicalLayer>> noBase = new EnumMap<>(LayerRequirementProfile.defaults().asMap());
            noBase.put(MethodRole.UTILITY, EnumSet.of(CHAIN, META));
            assertThrows(CalibrationConfigException.class, () -> new LayerRequirementProfile(noBase));
        }
    }

    // ── active layers ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("activeLayers()")
    class ActiveLayers {

        @Test
        @DisplayName("undeclared method gets exactly its role's required set")
        void undeclared() {
            assertEquals(EnumSet.of(BASE, CHAIN, META), resolver.activeLayers(MethodRole.UTILITY, null));
        }

        @Test
        @DisplayName("declaration with no active layers inherits the required set")
        void emptyDeclaration() {
            assertEquals(EnumSet.of(BASE, CHAIN, CONGRUENCE, META),
                resolver.activeLayers(MethodRole.REPORT, declared(MethodRole.REPORT, Set.of(), Map.of())));
        }

        @Test
        @DisplayName("declared active layers are used as declared, including extras")
        void declaredWithExtras() {
            Set<CanonicalLayer> active = EnumSet.of(BASE, CHAIN, META, QUESTION);
            assertEquals(active, resolver.activeLayers(MethodRole.UTILITY,
                declared(MethodRole.UTILITY, active, Map.of())));
        }

        @Test
        @DisplayName("approved waivers are not enforced for completeness; unapproved ones are")
        void enforced() {
            MethodDeclaration waived = declared(MethodRole.EXTRACT, EnumSet.of(BASE, CHAIN, META),
                Map.of(UNIT, new LayerWaiver("annex parser only", "calibration-board")));
            assertEquals(EnumSet.of(BASE, CHAIN, META), resolver.enforcedLayers(MethodRole.EXTRACT, waived));

            MethodDeclaration unapproved = declared(MethodRole.EXTRACT, EnumSet.of(BASE, CHAIN, META),
                Map.of(UNIT, new LayerWaiver("annex parser only", null)));
            assertEquals(EnumSet.of(BASE, CHAIN, UNIT, META), resolver.enforcedLayers(MethodRole.EXTRACT, unapproved));
            assertEquals(EnumSet.of(BASE, CHAIN, META), resolver.enforcedLayers(MethodRole.UTILITY, null));
        }
    }

    // ── violations ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("violations()")
    class Violations {

        @Test
        @DisplayName("required layer missing with no waiver")
        void missingWithoutWaiver() {
            List<String> problems = resolver.violations(
                declared(MethodRole.INGEST, EnumSet.of(BASE, CHAIN, META), Map.of()));
            assertEquals(1, problems.size());
            assertTrue(problems.get(0).contains("@u"));
        }

        @Test
        @DisplayName("approved waiver accepts the omission")
        void approvedWaiver() {
            assertTrue(resolver.violations(declared(MethodRole.INGEST, EnumSet.of(BASE, CHAIN, META),
                Map.of(UNIT, new LayerWaiver("annex parser only", "calibration-board")))).isEmpty());
        }

        @Test
        @DisplayName("waiver without approver is not accepted")
        void unapprovedWaiver() {
            List<String> problems = resolver.violations(declared(MethodRole.INGEST, EnumSet.of(BASE, CHAIN, META),
                Map.of(UNIT, new LayerWaiver("annex parser only", " "))));
            assertEquals(1, problems.size());
        }

        @Test
        @DisplayName("@b can never be waived")
        void baseNotWaivable() {
            List<String> problems = resolver.violations(declared(MethodRole.UTILITY, EnumSet.of(CHAIN, META),
                Map.of(BASE, new LayerWaiver("no intrinsic score", "calibration-board"))));
            assertEquals(1, problems.size());
            assertTrue(problems.get(0).contains("cannot be waived"));
        }

        @Test
        @DisplayName("validate() reports every violation across the registry at once")
        void validateAggregates() {
            MethodRegistry registry = new MethodRegistry(List.of(
                CalibrationFixtures.analyzerDeclaration(),
                new MethodDeclaration("m.One", MethodRole.INGEST, "1", EnumSet.of(BASE, META), Map.of(),
                    null, null, null, null, null, null)));
            CalibrationConfigException e = assertThrows(CalibrationConfigException.class,
                () -> resolver.validate(registry));
            assertTrue(e.getMessage().contains("@chain") && e.getMessage().contains("@u"), e.getMessage());
        }
    }
}
