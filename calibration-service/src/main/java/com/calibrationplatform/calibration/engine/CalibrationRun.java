package com.calibrationplatform.calibration.engine;

import com.calibrationplatform.common.certificate.CalibrationCertificate;

/**
 * Result of running the engine for one subject: either a certificate and the
 * threshold it is judged against, or a skip status.
 */
public record CalibrationRun(
    String methodId,
    String nodeId,
    CalibrationCertificate certificate,
    double threshold,
    String skipStatus
) {
    public static CalibrationRun completed(CalibrationCertificate certificate, double threshold) {
        return new CalibrationRun(certificate.method(), certificate.node(), certificate, threshold, null);
    }

    public static CalibrationRun skipped(String methodId, String nodeId, String status) {
        return new CalibrationRun(methodId, nodeId, null, 0.0, status);
    }

    public boolean isSkipped() {
        return skipStatus != null;
    }
}
