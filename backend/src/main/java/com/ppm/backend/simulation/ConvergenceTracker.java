package com.ppm.backend.simulation;

import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Running statistics over growing prefixes of an outcome array. Stability of a series is
 * {@code 1 - min(cv, 1)} over its last ten checkpoints. Location series (mean and percentiles)
 * take their cv against at least the outcome standard deviation, so a series centred on zero
 * is judged on its absolute drift.
 */
class ConvergenceTracker {

    private static final int WINDOW = 10;
    private static final double[] TRACKED_PERCENTILES = {10.0, 50.0, 90.0};

    private final int checkpointInterval;
    private final double threshold;
    private final List<Integer> checkpoints = new ArrayList<>();
    private final List<Double> means = new ArrayList<>();
    private final List<Double> variances = new ArrayList<>();
    private final Map<Double, List<Double>> percentileHistory = new LinkedHashMap<>();

    ConvergenceTracker(int checkpointInterval, double threshold) {
        this.checkpointInterval = Math.max(1, checkpointInterval);
        this.threshold = threshold;
        for (double p : TRACKED_PERCENTILES) {
            percentileHistory.put(p, new ArrayList<>());
        }
    }

    ConvergenceMetrics track(double[] outcomes) {
        double sum = 0.0;
        double sumSquares = 0.0;
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        for (int i = 0; i < outcomes.length; i++) {
            sum += outcomes[i];
            sumSquares += outcomes[i] * outcomes[i];
            int n = i + 1;
            if (n % checkpointInterval == 0 || n == outcomes.length) {
                double mean = sum / n;
                checkpoints.add(n);
                means.add(mean);
                variances.add(Math.max(0.0, sumSquares / n - mean * mean));
                double[] prefix = Arrays.copyOf(outcomes, n);
                percentile.setData(prefix);
                for (Map.Entry<Double, List<Double>> entry : percentileHistory.entrySet()) {
                    entry.getValue().add(percentile.evaluate(entry.getKey()));
                }
            }
        }
        double outcomeScale = variances.isEmpty() ? 0.0 : Math.sqrt(variances.get(variances.size() - 1));
        return finish(outcomeScale);
    }

    private ConvergenceMetrics finish(double outcomeScale) {
        double meanStability = stability(means, means.size(), outcomeScale);
        double varianceStability = stability(variances, variances.size(), 0.0);
        Map<Double, Double> percentileStability = new LinkedHashMap<>();
        percentileHistory.forEach((p, history) ->
                percentileStability.put(p, stability(history, history.size(), outcomeScale)));

        boolean converged = meanStability > threshold
                && varianceStability > threshold
                && percentileStability.values().stream().allMatch(value -> value > threshold);

        Integer iterationsToConvergence = null;
        if (converged) {
            for (int i = 2; i < means.size(); i++) {
                if (stability(means, i + 1, outcomeScale) > threshold && stability(variances, i + 1, 0.0) > threshold) {
                    iterationsToConvergence = checkpoints.get(i);
                    break;
                }
            }
        }
        return new ConvergenceMetrics(meanStability, varianceStability, percentileStability, converged,
                iterationsToConvergence);
    }

    /**
     * Stability of the window ending just before {@code end}; zero until a full window exists.
     * {@code scaleFloor} is the smallest magnitude the window's spread is measured against.
     */
    static double stability(List<Double> series, int end, double scaleFloor) {
        if (end < WINDOW) {
            return 0.0;
        }
        double[] window = series.subList(end - WINDOW, end).stream().mapToDouble(Double::doubleValue).toArray();
        double std = new StandardDeviation(false).evaluate(window);
        if (std == 0.0) {
            return 1.0;
        }
        double scale = Math.max(Math.abs(Arrays.stream(window).average().orElse(0.0)), scaleFloor);
        if (scale == 0.0) {
            return 0.0;
        }
        return 1.0 - Math.min(std / scale, 1.0);
    }
}
