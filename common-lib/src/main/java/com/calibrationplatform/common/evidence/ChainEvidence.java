package com.calibrationplatform.common.evidence;

import com.calibrationplatform.common.exception.EvidenceException;
import com.calibrationplatform.common.model.CanonicalLayer;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Wiring evidence for the CHAIN layer: which inputs the method needs, which it
 * would benefit from, and what the upstream graph actually provides.
 */
public record ChainEvidence(
    @JsonProperty("required_inputs")   Set<String> requiredInputs,
    @JsonProperty("beneficial_inputs") Set<String> beneficialInputs,
    @JsonProperty("provided_inputs")   Set<String> providedInputs,
    @JsonProperty("type_mismatches")   List<String> typeMismatches,
    @JsonProperty("schema_deviations") List<String> schemaDeviations,
    @JsonProperty("warnings")          List<String> warnings
) {
    public ChainEvidence {
        if (requiredInputs == null) throw new EvidenceException(CanonicalLayer.CHAIN, "required_inputs");
        if (providedInputs == null) throw new EvidenceException(CanonicalLayer.CHAIN, "provided_inputs");
        requiredInputs   = sorted(requiredInputs);
        providedInputs   = sorted(providedInputs);
        beneficialInputs = beneficialInputs == null ? Set.of() : sorted(beneficialInputs);
        typeMismatches   = typeMismatches == null ? List.of() : List.copyOf(typeMismatches);
        schemaDeviations = schemaDeviations == null ? List.of() : List.copyOf(schemaDeviations);
        warnings         = warnings == null ? List.of() : List.copyOf(warnings);
    }

    private static Set<String> sorted(Set<String> values) {
        return Collections.unmodifiableSortedSet(new TreeSet<>(values));
    }

    /** Every required and beneficial input provided, nothing else to report. */
    public static ChainEvidence clean(Set<String> inputs) {
        return new ChainEvidence(inputs, Set.of(), inputs, List.of(), List.of(), List.of());
    }
}
