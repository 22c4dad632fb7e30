package com.calibrationplatform.common.exception;

import com.calibrationplatform.common.model.CanonicalLayer;

/**
 * A layer could not be evaluated because a required evidence field is absent.
 */
public class EvidenceException extends RuntimeException {
    private final CanonicalLayer layer;
    private final String field;

    public EvidenceException(CanonicalLayer layer, String field) {
        super("[" + layer.symbol() + "] missing evidence field: " + field);
        this.layer = layer;
        this.field = field;
    }

    public CanonicalLayer getLayer() {
        return layer;
    }

    public String getField() {
        return field;
    }
}
