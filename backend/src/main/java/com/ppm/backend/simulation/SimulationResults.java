package com.ppm.backend.simulation;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Raw outcome arrays and run metadata of one simulation. Arrays are copied on the way in and out.
 */
@Getter
@ToString(of = {"simulationId", "iterationCount", "executionTime", "correlationAdjusted", "seed"})
public final class SimulationResults {

    private final String simulationId;
    private final Instant createdAt;
    private final int iterationCount;
    private final Duration executionTime;
    private final double[] costOutcomes;
    private final double[] scheduleOutcomes;
    private final List<RiskTrace> riskTraces;
    private final ConvergenceMetrics convergenceMetrics;
    private final boolean correlationAdjusted;
    private final Long seed;

    @Builder
    private SimulationResults(String simulationId,
                              Instant createdAt,
                              int iterationCount,
                              Duration executionTime,
                              double[] costOutcomes,
                              double[] scheduleOutcomes,
                              List<RiskTrace> riskTraces,
                              ConvergenceMetrics convergenceMetrics,
                              boolean correlationAdjusted,
                              Long seed) {
        this.simulationId = simulationId;
        this.createdAt = createdAt;
        this.iterationCount = iterationCount;
        this.executionTime = executionTime;
        this.costOutcomes = costOutcomes.clone();
        this.scheduleOutcomes = scheduleOutcomes.clone();
        this.riskTraces = riskTraces == null ? List.of() : List.copyOf(riskTraces);
        this.convergenceMetrics = convergenceMetrics;
        this.correlationAdjusted = correlationAdjusted;
        this.seed = seed;
    }

    public double[] getCostOutcomes() {
        return costOutcomes.clone();
    }

    public double[] getScheduleOutcomes() {
        return scheduleOutcomes.clone();
    }

    public long getExecutionTimeMs() {
        return executionTime == null ? 0L : executionTime.toMillis();
    }

    public Optional<RiskTrace> trace(String riskId) {
        return riskTraces.stream().filter(trace -> trace.riskId().equals(riskId)).findFirst();
    }
}
