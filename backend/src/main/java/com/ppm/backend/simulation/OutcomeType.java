package com.ppm.backend.simulation;

public enum OutcomeType {
    COST,
    SCHEDULE;

    public double[] outcomes(SimulationResults results) {
        return this == COST ? results.getCostOutcomes() : results.getScheduleOutcomes();
    }
}
