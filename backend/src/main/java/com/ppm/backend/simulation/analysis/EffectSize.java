package com.ppm.backend.simulation.analysis;

public enum EffectSize {
    NEGLIGIBLE,
    SMALL,
    MEDIUM,
    LARGE;

    public static EffectSize of(double cohensD) {
        double magnitude = Math.abs(cohensD);
        if (magnitude < 0.2) {
            return NEGLIGIBLE;
        }
        if (magnitude < 0.5) {
            return SMALL;
        }
        if (magnitude < 0.8) {
            return MEDIUM;
        }
        return LARGE;
    }
}
