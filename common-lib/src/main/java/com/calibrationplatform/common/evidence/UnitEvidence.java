package com.calibrationplatform.common.evidence;

import com.calibrationplatform.common.exception.EvidenceException;
import com.calibrationplatform.common.model.CanonicalLayer;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Document-structure evidence used by the UNIT layer's hard gates.
 * A missing field is an {@link EvidenceException}; an out-of-range value is an
 * {@link IllegalArgumentException}.
 */
public record UnitEvidence(
    @JsonProperty("structural_compliance")    Double structuralCompliance,
    @JsonProperty("indicator_matrix_present") Boolean indicatorMatrixPresent,
    @JsonProperty("ppi_matrix_present")       Boolean ppiMatrixPresent
) {
    public UnitEvidence {
        if (structuralCompliance == null) {
            throw new EvidenceException(CanonicalLayer.UNIT, "structural_compliance");
        }
        if (indicatorMatrixPresent == null) {
            throw new EvidenceException(CanonicalLayer.UNIT, "indicator_matrix_present");
        }
        if (ppiMatrixPresent == null) {
            throw new EvidenceException(CanonicalLayer.UNIT, "ppi_matrix_present");
        }
        if (structuralCompliance.isNaN() || structuralCompliance < 0.0 || structuralCompliance > 1.0) {
            throw new IllegalArgumentException(
                "structural_compliance must be in [0,1], got " + structuralCompliance);
        }
    }

    public static UnitEvidence complete() {
        return new UnitEvidence(1.0, true, true);
    }
}
