package com.calibrationplatform.common.exception;

/**
 * Fatal configuration error. Raised while loading or validating calibration parameters,
 * and by the fusion operator when a score escapes [0,1]. There is no fallback path.
 */
public class CalibrationConfigException extends RuntimeException {
    private final String section;

    public CalibrationConfigException(String section, String message) {
        super("[" + section + "] " + message);
        this.section = section;
    }

    public CalibrationConfigException(String section, String message, Throwable cause) {
        super("[" + section + "] " + message, cause);
        this.section = section;
    }

    public String getSection() {
        return section;
    }
}
