package com.ppm.backend.simulation;

import com.ppm.backend.exception.ConstructionValidationException;
import com.ppm.backend.exception.SimulationPreconditionException;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.math3.random.RandomGenerator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Validated, immutable impact distribution. Parameters are checked once here and never
 * again at sampling time.
 */
@Getter
@ToString(exclude = "marginal")
@EqualsAndHashCode(exclude = "marginal")
public final class ProbabilityDistribution {

    private final DistributionType type;
    private final Map<String, Double> parameters;
    private final Bounds bounds;
    @Getter(AccessLevel.NONE)
    private final Marginal marginal;

    public ProbabilityDistribution(DistributionType type, Map<String, Double> parameters) {
        this(type, parameters, null);
    }

    public ProbabilityDistribution(DistributionType type, Map<String, Double> parameters, Bounds bounds) {
        if (type == null) {
            throw new ConstructionValidationException("Distribution type is required");
        }
        if (parameters == null) {
            throw new ConstructionValidationException(type + " distribution parameters are required");
        }
        Map<String, Double> copy = new LinkedHashMap<>(parameters);
        type.check(copy);
        if (bounds != null) {
            bounds.check();
        }
        this.type = type;
        this.parameters = Collections.unmodifiableMap(copy);
        this.bounds = bounds;
        this.marginal = type.createMarginal(copy);
    }

    public static ProbabilityDistribution normal(double mean, double std) {
        return new ProbabilityDistribution(DistributionType.NORMAL, Map.of("mean", mean, "std", std));
    }

    public static ProbabilityDistribution triangular(double min, double mode, double max) {
        return new ProbabilityDistribution(DistributionType.TRIANGULAR, Map.of("min", min, "mode", mode, "max", max));
    }

    public static ProbabilityDistribution uniform(double min, double max) {
        return new ProbabilityDistribution(DistributionType.UNIFORM, Map.of("min", min, "max", max));
    }

    public static ProbabilityDistribution logNormal(double mu, double sigma) {
        return new ProbabilityDistribution(DistributionType.LOGNORMAL, Map.of("mu", mu, "sigma", sigma));
    }

    public double parameter(String key) {
        Double value = parameters.get(key);
        if (value == null) {
            throw new ConstructionValidationException(type + " distribution has no parameter '" + key + "'");
        }
        return value;
    }

    public double quantile(double p) {
        if (!(p >= 0.0 && p <= 1.0)) {
            throw new SimulationPreconditionException("Quantile probability must be within [0, 1], got " + p);
        }
        return clip(marginal.quantile(p));
    }

    public double mean() {
        return marginal.mean();
    }

    public double fromStandardNormal(double z) {
        return clip(marginal.fromStandardNormal(z));
    }

    public double sample(RandomGenerator rng) {
        return fromStandardNormal(rng.nextGaussian());
    }

    /**
     * Partial override: the given keys replace existing ones, everything else is kept.
     */
    public ProbabilityDistribution withParameters(Map<String, Double> changes) {
        if (changes == null || changes.isEmpty()) {
            return this;
        }
        Map<String, Double> merged = new LinkedHashMap<>(parameters);
        merged.putAll(changes);
        return new ProbabilityDistribution(type, merged, bounds);
    }

    /**
     * Switches family, keeping only the current parameters the new family understands.
     */
    public ProbabilityDistribution withType(DistributionType newType, Map<String, Double> changes) {
        if (newType == null || newType == type) {
            return withParameters(changes);
        }
        Map<String, Double> merged = new LinkedHashMap<>();
        parameters.forEach((key, value) -> {
            if (newType.accepts(key)) {
                merged.put(key, value);
            }
        });
        if (changes != null) {
            merged.putAll(changes);
        }
        return new ProbabilityDistribution(newType, merged, bounds);
    }

    public ProbabilityDistribution scaled(double factor) {
        if (!(factor > 0) || !Double.isFinite(factor)) {
            throw new ConstructionValidationException("Scale factor must be a positive finite number, got " + factor);
        }
        Bounds scaledBounds = bounds == null ? null : bounds.scaled(factor);
        return new ProbabilityDistribution(type, type.scale(parameters, factor), scaledBounds);
    }

    private double clip(double value) {
        return bounds == null ? value : bounds.clip(value);
    }

    public record Bounds(Double lower, Double upper) {

        void check() {
            if (lower != null && !Double.isFinite(lower)) {
                throw new ConstructionValidationException("Lower bound must be finite, got " + lower);
            }
            if (upper != null && !Double.isFinite(upper)) {
                throw new ConstructionValidationException("Upper bound must be finite, got " + upper);
            }
            if (lower != null && upper != null && lower > upper) {
                throw new ConstructionValidationException("Lower bound " + lower + " exceeds upper bound " + upper);
            }
        }

        double clip(double value) {
            double clipped = value;
            if (lower != null) {
                clipped = Math.max(lower, clipped);
            }
            if (upper != null) {
                clipped = Math.min(upper, clipped);
            }
            return clipped;
        }

        Bounds scaled(double factor) {
            return new Bounds(lower == null ? null : lower * factor, upper == null ? null : upper * factor);
        }
    }
}
