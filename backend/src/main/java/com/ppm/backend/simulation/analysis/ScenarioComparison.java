package com.ppm.backend.simulation.analysis;

public record ScenarioComparison(String baselineSimulationId,
                                 String comparisonSimulationId,
                                 int baselineIterations,
                                 int comparisonIterations,
                                 double significanceLevel,
                                 OutcomeDifference cost,
                                 OutcomeDifference schedule) {

    public boolean statisticallySignificant() {
        return cost.significant() || schedule.significant();
    }
}
