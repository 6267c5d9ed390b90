package com.ppm.backend.simulation.scenario;

import com.ppm.backend.exception.SimulationPreconditionException;
import com.ppm.backend.simulation.MonteCarloEngine;
import com.ppm.backend.simulation.OutcomeType;
import com.ppm.backend.simulation.Risk;
import com.ppm.backend.simulation.SimulationResults;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * One-at-a-time sensitivity: each risk is scaled to {@code 1 - range} and {@code 1 + range}
 * and both variants run on the same seed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SensitivityAnalysisService {

    private final ScenarioGenerator scenarioGenerator;
    private final MonteCarloEngine engine;

    public SensitivityResult analyze(Scenario scenario,
                                     List<String> riskIds,
                                     double variationRange,
                                     int iterations,
                                     Long seed,
                                     OutcomeType rankBy) {
        if (scenario == null) {
            throw new SimulationPreconditionException("Scenario is required");
        }
        if (!(variationRange > 0.0 && variationRange < 1.0)) {
            throw new SimulationPreconditionException("Variation range must be within (0, 1), got " + variationRange);
        }
        engine.validateInputs(scenario.risks(), iterations, null);
        OutcomeType ranking = rankBy == null ? OutcomeType.COST : rankBy;
        long commonSeed = seed != null ? seed : ThreadLocalRandom.current().nextLong();

        SimulationResults baseline = engine.runSimulation(scenario.risks(), iterations, commonSeed);
        List<SensitivityResult.Row> rows = new ArrayList<>();
        List<String> targets = riskIds == null
                ? scenario.risks().stream().map(Risk::id).toList()
                : riskIds;
        for (String riskId : targets) {
            Optional<Risk> risk = scenario.findRisk(riskId);
            if (risk.isEmpty()) {
                log.warn("Skipping sensitivity for unknown risk {} in scenario {}", riskId, scenario.id());
                continue;
            }
            Scenario low = scenarioGenerator.createScaledScenario(scenario, riskId, 1.0 - variationRange,
                    riskId + "_low");
            Scenario high = scenarioGenerator.createScaledScenario(scenario, riskId, 1.0 + variationRange,
                    riskId + "_high");
            SimulationResults lowResults = engine.runSimulation(low.risks(), iterations, commonSeed);
            SimulationResults highResults = engine.runSimulation(high.risks(), iterations, commonSeed);
            double baselineImpact = risk.get().baselineImpact();
            rows.add(SensitivityResult.Row.builder()
                    .riskId(riskId)
                    .riskName(risk.get().name())
                    .baselineImpact(baselineImpact)
                    .lowImpact(baselineImpact * (1.0 - variationRange))
                    .highImpact(baselineImpact * (1.0 + variationRange))
                    .lowCostMean(mean(lowResults.getCostOutcomes()))
                    .highCostMean(mean(highResults.getCostOutcomes()))
                    .lowScheduleMean(mean(lowResults.getScheduleOutcomes()))
                    .highScheduleMean(mean(highResults.getScheduleOutcomes()))
                    .build());
        }
        rows.sort(Comparator.comparingDouble((SensitivityResult.Row row) -> Math.abs(row.swing(ranking))).reversed()
                .thenComparing(SensitivityResult.Row::riskId));
        return new SensitivityResult(scenario.id(), variationRange, ranking,
                mean(baseline.getCostOutcomes()), mean(baseline.getScheduleOutcomes()), rows);
    }

    private static double mean(double[] values) {
        return Arrays.stream(values).average().orElse(0.0);
    }
}
