package com.ppm.backend.simulation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ConvergenceMetrics(double meanStability,
                                 double varianceStability,
                                 Map<Double, Double> percentileStability,
                                 boolean converged,
                                 Integer iterationsToConvergence) {

    public ConvergenceMetrics {
        percentileStability = percentileStability == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(percentileStability));
    }
}
