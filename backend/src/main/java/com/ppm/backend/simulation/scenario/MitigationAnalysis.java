package com.ppm.backend.simulation.scenario;

import lombok.Builder;

/**
 * Nominal cost-benefit of one mitigation. Ratios are null when their denominator is zero.
 */
@Builder
public record MitigationAnalysis(String strategyId,
                                 String riskId,
                                 double cost,
                                 double baselineRisk,
                                 double mitigatedRisk,
                                 double riskReduction,
                                 Double costBenefitRatio,
                                 double netPresentValue,
                                 Double returnOnInvestment) {
}
