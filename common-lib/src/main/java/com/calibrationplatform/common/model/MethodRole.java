package com.calibrationplatform.common.model;

import java.util.Locale;

/**
 * Functional role of an analysis method. Drives both the required layer set and
 * the unit-quality response curve.
 */
public enum MethodRole {
    ANALYZER,
    PROCESSOR,
    INGEST,
    STRUCTURE,
    EXTRACT,
    AGGREGATE,
    REPORT,
    UTILITY,
    ORCHESTRATOR,
    META,
    TRANSFORM;

    /** Lower-case name as it appears in configuration files. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MethodRole fromKey(String key) {
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
