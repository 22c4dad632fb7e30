package com.calibrationplatform.common.model;

import java.util.Locale;

/** Registry status of a method's intrinsic (BASE) quality scores. */
public enum IntrinsicStatus {
    COMPUTED,
    PENDING,
    EXCLUDED,
    NONE;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static IntrinsicStatus fromKey(String key) {
        if (key == null || key.isBlank()) return NONE;
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
