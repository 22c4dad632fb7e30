package com.calibrationplatform.common.evidence;

import com.calibrationplatform.common.exception.EvidenceException;
import com.calibrationplatform.common.model.CanonicalLayer;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Governance, transparency and cost observations for the META layer.
 */
public record MetaEvidence(
    @JsonProperty("formula_exported")        Boolean formulaExported,
    @JsonProperty("trace_complete")          Boolean traceComplete,
    @JsonProperty("logs_schema_conformant")  Boolean logsSchemaConformant,
    @JsonProperty("version_tagged")          Boolean versionTagged,
    @JsonProperty("config_hash_matches")     Boolean configHashMatches,
    @JsonProperty("signature_valid")         Boolean signatureValid,
    @JsonProperty("runtime_ms")              Double runtimeMs,
    @JsonProperty("memory_mb")               Double memoryMb
) {
    public MetaEvidence {
        require(formulaExported, "formula_exported");
        require(traceComplete, "trace_complete");
        require(logsSchemaConformant, "logs_schema_conformant");
        require(versionTagged, "version_tagged");
        require(configHashMatches, "config_hash_matches");
        require(signatureValid, "signature_valid");
        require(runtimeMs, "runtime_ms");
        require(memoryMb, "memory_mb");
        requireCost(runtimeMs, "runtime_ms");
        requireCost(memoryMb, "memory_mb");
    }

    private static void require(Object value, String field) {
        if (value == null) throw new EvidenceException(CanonicalLayer.META, field);
    }

    private static void requireCost(double value, String field) {
        if (!Double.isFinite(value) || value < 0.0) {
            throw new IllegalArgumentException(field + " must be finite and >= 0, got " + value);
        }
    }

    public int transparencyFlags() {
        return count(formulaExported, traceComplete, logsSchemaConformant);
    }

    public int governanceFlags() {
        return count(versionTagged, configHashMatches, signatureValid);
    }

    private static int count(Boolean... flags) {
        int n = 0;
        for (Boolean f : flags) if (f) n++;
        return n;
    }
}
