package com.ppm.backend.simulation.analysis;

public record PercentileAnalysis(String simulationId,
                                 int iterationCount,
                                 OutcomeStatistics cost,
                                 OutcomeStatistics schedule) {
}
