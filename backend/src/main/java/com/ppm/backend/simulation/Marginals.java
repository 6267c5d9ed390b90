package com.ppm.backend.simulation;

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.distribution.LogNormalDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.RealDistribution;

final class Marginals {

    private Marginals() {
    }

    static Marginal normal(double mean, double std) {
        return new Marginal() {
            private final NormalDistribution delegate = new NormalDistribution(null, mean, std);

            @Override
            public double quantile(double p) {
                return delegate.inverseCumulativeProbability(p);
            }

            @Override
            public double mean() {
                return mean;
            }

            @Override
            public double fromStandardNormal(double z) {
                return mean + std * z;
            }
        };
    }

    static Marginal logNormal(double mu, double sigma) {
        return new Marginal() {
            private final LogNormalDistribution delegate = new LogNormalDistribution(null, mu, sigma);

            @Override
            public double quantile(double p) {
                return delegate.inverseCumulativeProbability(p);
            }

            @Override
            public double mean() {
                return delegate.getNumericalMean();
            }

            @Override
            public double fromStandardNormal(double z) {
                return Math.exp(mu + sigma * z);
            }
        };
    }

    static Marginal of(RealDistribution distribution) {
        return new Marginal() {
            @Override
            public double quantile(double p) {
                return distribution.inverseCumulativeProbability(p);
            }

            @Override
            public double mean() {
                return distribution.getNumericalMean();
            }
        };
    }

    /**
     * Beta draw rescaled from [0, 1] onto [min, max].
     */
    static Marginal scaled(RealDistribution unit, double min, double max) {
        double width = max - min;
        return new Marginal() {
            @Override
            public double quantile(double p) {
                return min + width * unit.inverseCumulativeProbability(p);
            }

            @Override
            public double mean() {
                return min + width * unit.getNumericalMean();
            }
        };
    }

    static Marginal pointMass(double value) {
        return new Marginal() {
            @Override
            public double quantile(double p) {
                return value;
            }

            @Override
            public double mean() {
                return value;
            }

            @Override
            public double fromStandardNormal(double z) {
                return value;
            }
        };
    }

    /**
     * Inverse CDF interpolated linearly between the tabulated percentiles.
     */
    static Marginal percentileTable(double[] probabilities, double[] values) {
        PolynomialSplineFunction inverse = new LinearInterpolator().interpolate(probabilities, values);
        double mean = 0.0;
        for (int i = 1; i < probabilities.length; i++) {
            mean += (probabilities[i] - probabilities[i - 1]) * (values[i] + values[i - 1]) / 2.0;
        }
        double tableMean = mean;
        return new Marginal() {
            @Override
            public double quantile(double p) {
                return inverse.value(Math.min(1.0, Math.max(0.0, p)));
            }

            @Override
            public double mean() {
                return tableMean;
            }
        };
    }
}
