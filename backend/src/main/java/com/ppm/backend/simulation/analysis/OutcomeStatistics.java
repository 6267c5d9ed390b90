package com.ppm.backend.simulation.analysis;

import com.ppm.backend.exception.SimulationPreconditionException;
import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Builder
public record OutcomeStatistics(int sampleSize,
                                double mean,
                                double median,
                                double stdDev,
                                double variance,
                                double coefficientOfVariation,
                                double skewness,
                                double kurtosis,
                                double min,
                                double max,
                                Map<Double, Double> percentiles) {

    public OutcomeStatistics {
        percentiles = percentiles == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(percentiles));
    }

    public double percentile(double p) {
        Double value = percentiles.get(p);
        if (value == null) {
            throw new SimulationPreconditionException("Percentile " + p + " was not computed");
        }
        return value;
    }
}
