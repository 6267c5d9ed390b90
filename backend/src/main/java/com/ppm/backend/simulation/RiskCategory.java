package com.ppm.backend.simulation;

import java.util.Locale;

public enum RiskCategory {
    COST,
    SCHEDULE,
    RESOURCE,
    TECHNICAL,
    EXTERNAL,
    QUALITY,
    REGULATORY,
    OTHER;

    public static RiskCategory fromString(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }
}
