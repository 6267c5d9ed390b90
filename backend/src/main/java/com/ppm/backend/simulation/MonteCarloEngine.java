package com.ppm.backend.simulation;

import com.ppm.backend.config.SimulationProperties;
import com.ppm.backend.exception.NumericalStabilityException;
import com.ppm.backend.exception.SimulationPreconditionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Runs Monte Carlo iterations over a risk set. Stateless; every call builds its own generator.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MonteCarloEngine {

    private final SimulationProperties properties;
    private final DistributionSampler sampler;
    private final CorrelationInjector correlationInjector;

    public SimulationResults runSimulation(List<Risk> risks, int iterations) {
        return runSimulation(risks, iterations, null, null);
    }

    public SimulationResults runSimulation(List<Risk> risks, int iterations, Long randomSeed) {
        return runSimulation(risks, iterations, null, randomSeed);
    }

    public SimulationResults runSimulation(List<Risk> risks,
                                           int iterations,
                                           CorrelationMatrix correlations,
                                           Long randomSeed) {
        validateInputs(risks, iterations, correlations);

        String simulationId = UUID.randomUUID().toString();
        log.info("Starting simulation {} with {} risks and {} iterations", simulationId, risks.size(), iterations);
        long started = System.nanoTime();

        RandomGenerator rng = sampler.newGenerator(randomSeed);
        CorrelationInjector.CorrelatedSamples correlated =
                correlationInjector.generate(risks, correlations, iterations, rng);
        double[][] samples = correlated.samples();

        double[] costOutcomes = new double[iterations];
        double[] scheduleOutcomes = new double[iterations];
        List<RiskTrace> traces = new ArrayList<>(risks.size());
        for (int r = 0; r < risks.size(); r++) {
            Risk risk = risks.get(r);
            double[] impacts = samples[r];
            for (int i = 0; i < iterations; i++) {
                if (!Double.isFinite(impacts[i])) {
                    throw new NumericalStabilityException(
                            "Risk '" + risk.id() + "' produced a non-finite impact at iteration " + i);
                }
                if (risk.impactType().affectsCost()) {
                    costOutcomes[i] += impacts[i];
                }
                if (risk.impactType().affectsSchedule()) {
                    scheduleOutcomes[i] += impacts[i];
                }
            }
            traces.add(new RiskTrace(risk.id(), risk.name(), risk.impactType(), impacts));
        }
        requireFinite(costOutcomes, "cost");
        requireFinite(scheduleOutcomes, "schedule");

        boolean tracksCost = risks.stream().anyMatch(risk -> risk.impactType().affectsCost());
        ConvergenceMetrics convergence = new ConvergenceTracker(
                Math.max(properties.getConvergenceCheckpoint(), iterations / 20),
                properties.getConvergenceThreshold())
                .track(tracksCost ? costOutcomes : scheduleOutcomes);

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        log.info("Simulation {} finished in {} ms (converged={})",
                simulationId, elapsed.toMillis(), convergence.converged());

        return SimulationResults.builder()
                .simulationId(simulationId)
                .createdAt(Instant.now())
                .iterationCount(iterations)
                .executionTime(elapsed)
                .costOutcomes(costOutcomes)
                .scheduleOutcomes(scheduleOutcomes)
                .riskTraces(traces)
                .convergenceMetrics(convergence)
                .correlationAdjusted(correlated.adjusted())
                .seed(randomSeed)
                .build();
    }

    /**
     * All caller errors surface here, before a generator exists.
     */
    public void validateInputs(List<Risk> risks, int iterations, CorrelationMatrix correlations) {
        if (risks == null || risks.isEmpty()) {
            throw new SimulationPreconditionException("At least one risk is required to run a simulation");
        }
        Set<String> ids = new HashSet<>();
        for (Risk risk : risks) {
            if (risk == null) {
                throw new SimulationPreconditionException("Risk list contains a null entry");
            }
            if (!ids.add(risk.id())) {
                throw new SimulationPreconditionException("Duplicate risk id: " + risk.id());
            }
        }
        validateIterations(iterations);
        if (correlations != null) {
            for (String riskId : correlations.getRiskIds()) {
                if (!ids.contains(riskId)) {
                    throw new SimulationPreconditionException("Correlation matrix references unknown risk: " + riskId);
                }
            }
        }
    }

    public void validateIterations(int iterations) {
        if (iterations < properties.getMinIterations()) {
            throw new SimulationPreconditionException("Iterations must be at least "
                    + properties.getMinIterations() + ", got " + iterations);
        }
        if (iterations > properties.getMaxIterations()) {
            throw new SimulationPreconditionException("Iterations must not exceed "
                    + properties.getMaxIterations() + ", got " + iterations);
        }
    }

    private static void requireFinite(double[] outcomes, String dimension) {
        for (int i = 0; i < outcomes.length; i++) {
            if (!Double.isFinite(outcomes[i])) {
                throw new NumericalStabilityException(
                        "Non-finite " + dimension + " outcome at iteration " + i);
            }
        }
    }
}
