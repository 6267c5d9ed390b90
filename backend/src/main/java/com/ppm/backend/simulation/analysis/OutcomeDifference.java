package com.ppm.backend.simulation.analysis;

import com.ppm.backend.simulation.OutcomeType;
import lombok.Builder;

/**
 * Comparison of one outcome dimension between two runs. Differences are comparison minus baseline.
 */
@Builder
public record OutcomeDifference(OutcomeType outcomeType,
                                double baselineMean,
                                double comparisonMean,
                                double baselineStdDev,
                                double comparisonStdDev,
                                double meanDifference,
                                double relativeDifferencePct,
                                double tStatistic,
                                double pValue,
                                double mannWhitneyPValue,
                                double kolmogorovSmirnovPValue,
                                double cohensD,
                                EffectSize effectSize,
                                Interval meanDifferenceInterval,
                                boolean significant,
                                String recommendation) {
}
