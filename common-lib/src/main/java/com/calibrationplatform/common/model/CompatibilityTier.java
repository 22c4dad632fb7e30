package com.calibrationplatform.common.model;

import java.util.Locale;

/** How strongly a method declares itself suited to a question, dimension or policy area. */
public enum CompatibilityTier {
    PRIMARY,
    SECONDARY,
    COMPATIBLE,
    UNDECLARED,
    INCOMPATIBLE;

    public static CompatibilityTier fromKey(String key) {
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
