package com.calibrationplatform.calibration.dto;

import com.calibrationplatform.common.certificate.CalibrationCertificate;
import com.calibrationplatform.common.decision.Decision;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** {@code certificate} is absent for skipped subjects. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubjectCalibrationResponse(
    @JsonProperty("decision")    Decision decision,
    @JsonProperty("certificate") CalibrationCertificate certificate
) {}
