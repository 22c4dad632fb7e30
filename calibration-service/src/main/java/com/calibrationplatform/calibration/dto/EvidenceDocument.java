package com.calibrationplatform.calibration.dto;

import com.calibrationplatform.common.evidence.ChainEvidence;
import com.calibrationplatform.common.evidence.EvidenceBundle;
import com.calibrationplatform.common.evidence.MetaEvidence;
import com.calibrationplatform.common.evidence.UnitEvidence;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Set;

/**
 * Request-side evidence. Every field is optional on the wire; a missing field surfaces
 * later as a fail-closed layer naming it, not as a rejected request.
 */
public record EvidenceDocument(
    @JsonProperty("chain") Chain chain,
    @JsonProperty("unit")  Unit unit,
    @JsonProperty("meta")  Meta meta
) {

    public record Chain(
        @JsonProperty("required_inputs")   Set<String> requiredInputs,
        @JsonProperty("beneficial_inputs") Set<String> beneficialInputs,
        @JsonProperty("provided_inputs")   Set<String> providedInputs,
        @JsonProperty("type_mismatches")   List<String> typeMismatches,
        @JsonProperty("schema_deviations") List<String> schemaDeviations,
        @JsonProperty("warnings")          List<String> warnings
    ) {}

    public record Unit(
        @JsonProperty("structural_compliance")    Double structuralCompliance,
        @JsonProperty("indicator_matrix_present") Boolean indicatorMatrixPresent,
        @JsonProperty("ppi_matrix_present")       Boolean ppiMatrixPresent
    ) {}

    public record Meta(
        @JsonProperty("formula_exported")       Boolean formulaExported,
        @JsonProperty("trace_complete")         Boolean traceComplete,
        @JsonProperty("logs_schema_conformant") Boolean logsSchemaConformant,
        @JsonProperty("version_tagged")         Boolean versionTagged,
        @JsonProperty("config_hash_matches")    Boolean configHashMatches,
        @JsonProperty("signature_valid")        Boolean signatureValid,
        @JsonProperty("runtime_ms")             Double runtimeMs,
        @JsonProperty("memory_mb")              Double memoryMb
    ) {}

    public EvidenceBundle toBundle() {
        return EvidenceBundle.collect(
            chain == null ? null : () -> new ChainEvidence(chain.requiredInputs(), chain.beneficialInputs(),
                chain.providedInputs(), chain.typeMismatches(), chain.schemaDeviations(), chain.warnings()),
            unit == null ? null : () -> new UnitEvidence(unit.structuralCompliance(),
                unit.indicatorMatrixPresent(), unit.ppiMatrixPresent()),
            meta == null ? null : () -> new MetaEvidence(meta.formulaExported(), meta.traceComplete(),
                meta.logsSchemaConformant(), meta.versionTagged(), meta.configHashMatches(),
                meta.signatureValid(), meta.runtimeMs(), meta.memoryMb()));
    }
}
