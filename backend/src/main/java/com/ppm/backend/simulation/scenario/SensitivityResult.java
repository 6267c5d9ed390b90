package com.ppm.backend.simulation.scenario;

import com.ppm.backend.simulation.OutcomeType;
import lombok.Builder;

import java.util.List;

/**
 * Tornado rows ranked by absolute swing on {@code rankedBy}.
 */
public record SensitivityResult(String scenarioId,
                                double variationRange,
                                OutcomeType rankedBy,
                                double baselineCostMean,
                                double baselineScheduleMean,
                                List<Row> rows) {

    public SensitivityResult {
        rows = List.copyOf(rows);
    }

    @Builder
    public record Row(String riskId,
                      String riskName,
                      double baselineImpact,
                      double lowImpact,
                      double highImpact,
                      double lowCostMean,
                      double highCostMean,
                      double lowScheduleMean,
                      double highScheduleMean) {

        public double costSwing() {
            return highCostMean - lowCostMean;
        }

        public double scheduleSwing() {
            return highScheduleMean - lowScheduleMean;
        }

        public double swing(OutcomeType outcomeType) {
            return outcomeType == OutcomeType.COST ? costSwing() : scheduleSwing();
        }
    }
}
