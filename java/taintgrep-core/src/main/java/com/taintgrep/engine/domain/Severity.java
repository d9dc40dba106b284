package com.taintgrep.engine.domain;

import java.util.Locale;

/**
 * Finding severity, ordered from least to most severe.
 */
public enum Severity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    public boolean isAtLeast(Severity other) {
        return other == null || compareTo(other) >= 0;
    }

    /**
     * Lenient parse used by configuration surfaces.
     *
     * @param value severity name in any case
     * @return matching severity, or null when blank or unknown
     */
    public static Severity parse(String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (Severity severity : values()) {
            if (severity.name().equals(normalized)) {
                return severity;
            }
        }
        return null;
    }
}
