package com.ppm.backend.dto;

import com.ppm.backend.simulation.analysis.Interval;
import com.ppm.backend.simulation.analysis.OutcomeStatistics;
import com.ppm.backend.simulation.analysis.RiskContribution;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class BudgetVarianceAnalysis {
    private Long projectId;

    // Baseline and current state, as stored
    private double baselineBudget;
    private double currentSpend;
    private double remainingBudget;
    private double contingencyReserve;

    // Simulated final cost = baseline + summed risk impact
    private double expectedFinalCost;
    private double varianceFromBaseline;
    private double variancePercentage;
    private double probabilityWithinBudget;
    private double probabilityWithin10Percent;
    private double costAtRiskP95;
    private double recommendedContingency;

    private OutcomeStatistics percentiles;
    private Interval confidenceInterval;
    private List<RiskContribution> topRiskContributors;

    private int riskCount;
    private String simulationId;
    private String note;
}
