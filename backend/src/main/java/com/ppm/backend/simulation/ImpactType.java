package com.ppm.backend.simulation;

import java.util.Locale;
import java.util.Optional;

public enum ImpactType {
    COST(true, false),
    SCHEDULE(false, true),
    BOTH(true, true);

    private final boolean cost;
    private final boolean schedule;

    ImpactType(boolean cost, boolean schedule) {
        this.cost = cost;
        this.schedule = schedule;
    }

    public boolean affectsCost() {
        return cost;
    }

    public boolean affectsSchedule() {
        return schedule;
    }

    /**
     * Empty for blank or unrecognised values.
     */
    public static Optional<ImpactType> find(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * Unrecognised values count against both dimensions.
     */
    public static ImpactType fromString(String value) {
        return find(value).orElse(BOTH);
    }
}
