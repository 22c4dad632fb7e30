package com.calibrationplatform.common.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Approved exemption from a required layer. */
public record LayerWaiver(
    @JsonProperty("justification") String justification,
    @JsonProperty("approved_by")   String approvedBy
) {
    public boolean isApproved() {
        return justification != null && !justification.isBlank()
            && approvedBy != null && !approvedBy.isBlank();
    }
}
