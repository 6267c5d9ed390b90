package com.ppm.backend.simulation.analysis;

import com.ppm.backend.config.SimulationProperties;
import com.ppm.backend.exception.SimulationPreconditionException;
import com.ppm.backend.simulation.OutcomeType;
import com.ppm.backend.simulation.RiskTrace;
import com.ppm.backend.simulation.SimulationResults;
import lombok.RequiredArgsConstructor;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.inference.KolmogorovSmirnovTest;
import org.apache.commons.math3.stat.inference.MannWhitneyUTest;
import org.apache.commons.math3.stat.inference.TTest;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure statistics over {@link SimulationResults}. Percentiles interpolate linearly between
 * order statistics; the significance test of a comparison is a two-sided Welch t-test.
 */
@Service
@RequiredArgsConstructor
public class ResultsAnalyzer {

    private final SimulationProperties properties;

    public PercentileAnalysis calculatePercentiles(SimulationResults results) {
        requireResults(results, "results");
        return new PercentileAnalysis(results.getSimulationId(), results.getIterationCount(),
                describe(results.getCostOutcomes()), describe(results.getScheduleOutcomes()));
    }

    public OutcomeStatistics describe(double[] outcomes) {
        if (outcomes == null || outcomes.length == 0) {
            throw new SimulationPreconditionException("Cannot describe an empty outcome array");
        }
        DescriptiveStatistics stats = new DescriptiveStatistics(outcomes);
        Percentile percentile = linearPercentile(outcomes);
        Map<Double, Double> markers = new LinkedHashMap<>();
        for (Double p : properties.getPercentiles()) {
            markers.put(p, percentile.evaluate(p));
        }
        double mean = stats.getMean();
        double stdDev = outcomes.length > 1 ? stats.getStandardDeviation() : 0.0;
        return OutcomeStatistics.builder()
                .sampleSize(outcomes.length)
                .mean(mean)
                .median(percentile.evaluate(50.0))
                .stdDev(stdDev)
                .variance(stdDev * stdDev)
                .coefficientOfVariation(mean == 0.0 ? 0.0 : stdDev / Math.abs(mean))
                .skewness(finiteOrZero(stats.getSkewness()))
                .kurtosis(finiteOrZero(stats.getKurtosis()))
                .min(stats.getMin())
                .max(stats.getMax())
                .percentiles(markers)
                .build();
    }

    /**
     * Single percentile marker, {@code percentile} in (0, 100].
     */
    public double quantile(double[] outcomes, double percentile) {
        if (outcomes == null || outcomes.length == 0) {
            throw new SimulationPreconditionException("Cannot take a percentile of an empty outcome array");
        }
        if (!(percentile > 0.0 && percentile <= 100.0)) {
            throw new SimulationPreconditionException("Percentile must be within (0, 100], got " + percentile);
        }
        return linearPercentile(outcomes).evaluate(percentile);
    }

    public ConfidenceIntervals generateConfidenceIntervals(SimulationResults results, OutcomeType outcomeType) {
        return generateConfidenceIntervals(results, outcomeType, properties.getConfidenceLevels());
    }

    public ConfidenceIntervals generateConfidenceIntervals(SimulationResults results,
                                                           OutcomeType outcomeType,
                                                           List<Double> confidenceLevels) {
        requireResults(results, "results");
        if (outcomeType == null) {
            throw new SimulationPreconditionException("Outcome type is required");
        }
        return intervals(outcomeType, outcomeType.outcomes(results), confidenceLevels);
    }

    /**
     * Equal-tailed percentile intervals over an arbitrary outcome array.
     */
    public ConfidenceIntervals intervals(OutcomeType outcomeType, double[] outcomes, List<Double> confidenceLevels) {
        if (confidenceLevels == null || confidenceLevels.isEmpty()) {
            throw new SimulationPreconditionException("At least one confidence level is required");
        }
        if (outcomes == null || outcomes.length == 0) {
            throw new SimulationPreconditionException("Cannot build intervals over an empty outcome array");
        }
        Percentile percentile = linearPercentile(outcomes);
        List<Interval> intervals = new ArrayList<>(confidenceLevels.size());
        for (Double level : confidenceLevels) {
            requireConfidenceLevel(level);
            double alpha = 1.0 - level;
            intervals.add(new Interval(level,
                    percentile.evaluate(100.0 * alpha / 2.0),
                    percentile.evaluate(100.0 * (1.0 - alpha / 2.0))));
        }
        return new ConfidenceIntervals(outcomeType, intervals);
    }

    public List<RiskContribution> identifyTopRiskContributors(SimulationResults results) {
        return identifyTopRiskContributors(results, properties.getTopContributors());
    }

    public List<RiskContribution> identifyTopRiskContributors(SimulationResults results, int topN) {
        requireResults(results, "results");
        if (topN <= 0) {
            throw new SimulationPreconditionException("Top contributor count must be positive, got " + topN);
        }
        List<RiskTrace> traces = results.getRiskTraces();
        if (traces.isEmpty()) {
            return List.of();
        }
        double[] costOutcomes = results.getCostOutcomes();
        double[] scheduleOutcomes = results.getScheduleOutcomes();

        List<double[]> impacts = new ArrayList<>(traces.size());
        List<DescriptiveStatistics> stats = new ArrayList<>(traces.size());
        double totalVariance = 0.0;
        for (RiskTrace trace : traces) {
            double[] values = trace.impacts();
            DescriptiveStatistics descriptive = new DescriptiveStatistics(values);
            impacts.add(values);
            stats.add(descriptive);
            totalVariance += sampleVariance(descriptive);
        }

        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < traces.size(); i++) {
            order.add(i);
        }
        // equal variance (fixed-value risks included) falls back to impact magnitude
        order.sort(Comparator.<Integer>comparingDouble(i -> sampleVariance(stats.get(i))).reversed()
                .thenComparing(Comparator.<Integer>comparingDouble(i -> Math.abs(stats.get(i).getMean())).reversed())
                .thenComparing(i -> traces.get(i).riskId()));

        List<RiskContribution> contributions = new ArrayList<>();
        for (int index : order.subList(0, Math.min(topN, order.size()))) {
            RiskTrace trace = traces.get(index);
            DescriptiveStatistics descriptive = stats.get(index);
            double variance = sampleVariance(descriptive);
            Map<String, Double> effects = new LinkedHashMap<>();
            for (int other = 0; other < traces.size(); other++) {
                if (other != index) {
                    effects.put(traces.get(other).riskId(), correlation(impacts.get(index), impacts.get(other)));
                }
            }
            contributions.add(RiskContribution.builder()
                    .riskId(trace.riskId())
                    .riskName(trace.riskName())
                    .impactType(trace.impactType())
                    .meanImpact(descriptive.getMean())
                    .stdDev(Math.sqrt(variance))
                    .variance(variance)
                    .minImpact(descriptive.getMin())
                    .maxImpact(descriptive.getMax())
                    .contributionPercentage(totalVariance > 0 ? variance / totalVariance * 100.0 : 0.0)
                    .costCorrelation(correlation(impacts.get(index), costOutcomes))
                    .scheduleCorrelation(correlation(impacts.get(index), scheduleOutcomes))
                    .correlationEffects(effects)
                    .build());
        }
        return contributions;
    }

    public ScenarioComparison compareScenarios(SimulationResults baseline, SimulationResults comparison) {
        return compareScenarios(baseline, comparison, properties.getSignificanceLevel());
    }

    public ScenarioComparison compareScenarios(SimulationResults baseline,
                                               SimulationResults comparison,
                                               double significanceLevel) {
        requireResults(baseline, "baseline results");
        requireResults(comparison, "comparison results");
        if (!(significanceLevel > 0.0 && significanceLevel < 1.0)) {
            throw new SimulationPreconditionException("Significance level must be within (0, 1), got " + significanceLevel);
        }
        OutcomeDifference cost = compare(OutcomeType.COST,
                baseline.getCostOutcomes(), comparison.getCostOutcomes(), significanceLevel);
        OutcomeDifference schedule = compare(OutcomeType.SCHEDULE,
                baseline.getScheduleOutcomes(), comparison.getScheduleOutcomes(), significanceLevel);
        return new ScenarioComparison(baseline.getSimulationId(), comparison.getSimulationId(),
                baseline.getIterationCount(), comparison.getIterationCount(), significanceLevel, cost, schedule);
    }

    OutcomeDifference compare(OutcomeType outcomeType, double[] baseline, double[] comparison, double significanceLevel) {
        if (baseline.length == 0 || comparison.length == 0) {
            throw new SimulationPreconditionException("Cannot compare empty " + outcomeType + " outcome arrays");
        }
        DescriptiveStatistics left = new DescriptiveStatistics(baseline);
        DescriptiveStatistics right = new DescriptiveStatistics(comparison);
        double baselineMean = left.getMean();
        double comparisonMean = right.getMean();
        double baselineVar = sampleVariance(left);
        double comparisonVar = sampleVariance(right);
        double difference = comparisonMean - baselineMean;
        int n1 = baseline.length;
        int n2 = comparison.length;

        boolean degenerate = n1 < 2 || n2 < 2 || (baselineVar == 0.0 && comparisonVar == 0.0);
        double fallbackP = Double.compare(baselineMean, comparisonMean) == 0 ? 1.0 : 0.0;
        double tStatistic = 0.0;
        double pValue = fallbackP;
        double mannWhitney = fallbackP;
        double ks = fallbackP;
        if (!degenerate) {
            TTest tTest = new TTest();
            tStatistic = tTest.t(comparison, baseline);
            pValue = tTest.tTest(comparison, baseline);
            mannWhitney = finiteOr(new MannWhitneyUTest().mannWhitneyUTest(baseline, comparison), fallbackP);
            ks = finiteOr(new KolmogorovSmirnovTest().kolmogorovSmirnovTest(baseline, comparison), fallbackP);
        }

        double pooled = n1 + n2 > 2
                ? Math.sqrt(((n1 - 1) * baselineVar + (n2 - 1) * comparisonVar) / (n1 + n2 - 2))
                : 0.0;
        double cohensD = pooled > 0 ? difference / pooled : 0.0;
        EffectSize effectSize = EffectSize.of(cohensD);
        double relative = baselineMean == 0.0 ? 0.0 : difference / Math.abs(baselineMean) * 100.0;
        boolean significant = pValue < significanceLevel;

        return OutcomeDifference.builder()
                .outcomeType(outcomeType)
                .baselineMean(baselineMean)
                .comparisonMean(comparisonMean)
                .baselineStdDev(Math.sqrt(baselineVar))
                .comparisonStdDev(Math.sqrt(comparisonVar))
                .meanDifference(difference)
                .relativeDifferencePct(relative)
                .tStatistic(tStatistic)
                .pValue(pValue)
                .mannWhitneyPValue(mannWhitney)
                .kolmogorovSmirnovPValue(ks)
                .cohensD(cohensD)
                .effectSize(effectSize)
                .meanDifferenceInterval(meanDifferenceInterval(difference, baselineVar, n1, comparisonVar, n2))
                .significant(significant)
                .recommendation(recommendation(significant, effectSize, relative))
                .build();
    }

    /**
     * 95% interval of the mean difference with Welch-Satterthwaite degrees of freedom.
     */
    private static Interval meanDifferenceInterval(double difference, double var1, int n1, double var2, int n2) {
        double a = n1 > 0 ? var1 / n1 : 0.0;
        double b = n2 > 0 ? var2 / n2 : 0.0;
        double standardError = Math.sqrt(a + b);
        if (standardError == 0.0 || n1 < 2 || n2 < 2) {
            return new Interval(0.95, difference, difference);
        }
        double df = (a + b) * (a + b) / (a * a / (n1 - 1) + b * b / (n2 - 1));
        double critical = new TDistribution(df).inverseCumulativeProbability(0.975);
        return new Interval(0.95, difference - critical * standardError, difference + critical * standardError);
    }

    static String recommendation(boolean significant, EffectSize effectSize, double relativeDifference) {
        if (!significant) {
            return "No statistically significant difference detected. Scenarios are likely equivalent.";
        }
        String direction = relativeDifference > 0 ? "higher" : "lower";
        return switch (effectSize) {
            case LARGE -> "Strong evidence of " + direction + " outcomes. Consider this scenario carefully.";
            case MEDIUM -> "Moderate evidence of " + direction + " outcomes. Further analysis may be warranted.";
            case SMALL -> "Weak evidence of " + direction
                    + " outcomes. Difference may not be practically significant.";
            case NEGLIGIBLE -> "Statistically significant but negligible practical difference.";
        };
    }

    public static void requireConfidenceLevel(Double level) {
        if (level == null || !(level > 0.0 && level < 1.0)) {
            throw new SimulationPreconditionException("Confidence level must be within (0, 1), got " + level);
        }
    }

    private static Percentile linearPercentile(double[] outcomes) {
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        percentile.setData(outcomes);
        return percentile;
    }

    private static double sampleVariance(DescriptiveStatistics stats) {
        return stats.getN() > 1 ? stats.getVariance() : 0.0;
    }

    private static double correlation(double[] x, double[] y) {
        if (x.length < 2 || x.length != y.length) {
            return 0.0;
        }
        return finiteOr(new PearsonsCorrelation().correlation(x, y), 0.0);
    }

    private static double finiteOrZero(double value) {
        return finiteOr(value, 0.0);
    }

    private static double finiteOr(double value, double fallback) {
        return Double.isFinite(value) ? value : fallback;
    }

    private static void requireResults(SimulationResults results, String label) {
        if (results == null) {
            throw new SimulationPreconditionException("Simulation " + label + " are required");
        }
    }
}
