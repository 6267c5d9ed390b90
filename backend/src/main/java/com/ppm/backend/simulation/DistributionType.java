package com.ppm.backend.simulation;

import com.ppm.backend.exception.ConstructionValidationException;
import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.math3.distribution.TriangularDistribution;
import org.apache.commons.math3.distribution.UniformRealDistribution;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Closed set of supported impact distributions. Each constant owns its parameter
 * validation, its marginal and its scaling rule.
 */
public enum DistributionType {

    NORMAL(Set.of("mean", "std")) {
        @Override
        void validate(Map<String, Double> params) {
            requirePositive(params, "std");
        }

        @Override
        Marginal createMarginal(Map<String, Double> params) {
            return Marginals.normal(params.get("mean"), params.get("std"));
        }

        @Override
        Map<String, Double> scale(Map<String, Double> params, double factor) {
            Map<String, Double> scaled = new LinkedHashMap<>(params);
            scaled.put("mean", params.get("mean") * factor);
            scaled.put("std", params.get("std") * factor);
            return scaled;
        }
    },

    TRIANGULAR(Set.of("min", "mode", "max")) {
        @Override
        void validate(Map<String, Double> params) {
            double min = params.get("min");
            double mode = params.get("mode");
            double max = params.get("max");
            if (min > max) {
                throw invalid("min", "must be <= max (" + max + "), got " + min);
            }
            if (mode < min || mode > max) {
                throw invalid("mode", "must lie within [" + min + ", " + max + "], got " + mode);
            }
        }

        @Override
        Marginal createMarginal(Map<String, Double> params) {
            double min = params.get("min");
            double max = params.get("max");
            if (min == max) {
                return Marginals.pointMass(min);
            }
            return Marginals.of(new TriangularDistribution(null, min, params.get("mode"), max));
        }

        @Override
        Map<String, Double> scale(Map<String, Double> params, double factor) {
            return multiplyAll(params, factor);
        }
    },

    UNIFORM(Set.of("min", "max")) {
        @Override
        void validate(Map<String, Double> params) {
            double min = params.get("min");
            double max = params.get("max");
            if (min > max) {
                throw invalid("min", "must be <= max (" + max + "), got " + min);
            }
        }

        @Override
        Marginal createMarginal(Map<String, Double> params) {
            double min = params.get("min");
            double max = params.get("max");
            if (min == max) {
                return Marginals.pointMass(min);
            }
            return Marginals.of(new UniformRealDistribution(null, min, max));
        }

        @Override
        Map<String, Double> scale(Map<String, Double> params, double factor) {
            return multiplyAll(params, factor);
        }
    },

    LOGNORMAL(Set.of("mu", "sigma")) {
        @Override
        void validate(Map<String, Double> params) {
            requirePositive(params, "sigma");
        }

        @Override
        Marginal createMarginal(Map<String, Double> params) {
            return Marginals.logNormal(params.get("mu"), params.get("sigma"));
        }

        @Override
        Map<String, Double> scale(Map<String, Double> params, double factor) {
            Map<String, Double> scaled = new LinkedHashMap<>(params);
            scaled.put("mu", params.get("mu") + Math.log(factor));
            return scaled;
        }
    },

    BETA(Set.of("alpha", "beta")) {
        @Override
        boolean accepts(String key) {
            return super.accepts(key) || "min".equals(key) || "max".equals(key);
        }

        @Override
        void validate(Map<String, Double> params) {
            requirePositive(params, "alpha");
            requirePositive(params, "beta");
            boolean hasMin = params.containsKey("min");
            boolean hasMax = params.containsKey("max");
            if (hasMin != hasMax) {
                throw invalid(hasMin ? "max" : "min", "is required when the other bound is given");
            }
            if (hasMin && params.get("min") >= params.get("max")) {
                throw invalid("min", "must be < max (" + params.get("max") + "), got " + params.get("min"));
            }
        }

        @Override
        Marginal createMarginal(Map<String, Double> params) {
            BetaDistribution unit = new BetaDistribution(null, params.get("alpha"), params.get("beta"));
            return Marginals.scaled(unit, params.getOrDefault("min", 0.0), params.getOrDefault("max", 1.0));
        }

        @Override
        Map<String, Double> scale(Map<String, Double> params, double factor) {
            Map<String, Double> scaled = new LinkedHashMap<>(params);
            scaled.put("min", params.getOrDefault("min", 0.0) * factor);
            scaled.put("max", params.getOrDefault("max", 1.0) * factor);
            return scaled;
        }
    },

    CUSTOM(Set.of("p0", "p100")) {
        @Override
        boolean accepts(String key) {
            return percentileOf(key) >= 0;
        }

        @Override
        void validate(Map<String, Double> params) {
            TreeMap<Integer, Double> table = table(params);
            if (table.size() != params.size()) {
                throw invalid(String.join(",", params.keySet()), "names the same percentile more than once");
            }
            double previous = Double.NEGATIVE_INFINITY;
            String previousKey = null;
            for (Map.Entry<Integer, Double> entry : table.entrySet()) {
                if (entry.getValue() < previous) {
                    throw invalid("p" + entry.getKey(), "must be >= " + previousKey + " (" + previous
                            + "), got " + entry.getValue());
                }
                previous = entry.getValue();
                previousKey = "p" + entry.getKey();
            }
        }

        @Override
        Marginal createMarginal(Map<String, Double> params) {
            TreeMap<Integer, Double> table = table(params);
            double[] probabilities = new double[table.size()];
            double[] values = new double[table.size()];
            int i = 0;
            for (Map.Entry<Integer, Double> entry : table.entrySet()) {
                probabilities[i] = entry.getKey() / 100.0;
                values[i] = entry.getValue();
                i++;
            }
            return Marginals.percentileTable(probabilities, values);
        }

        @Override
        Map<String, Double> scale(Map<String, Double> params, double factor) {
            return multiplyAll(params, factor);
        }
    };

    private static final Pattern PERCENTILE_KEY = Pattern.compile("p(\\d{1,3})");

    private final Set<String> requiredKeys;

    DistributionType(Set<String> requiredKeys) {
        this.requiredKeys = requiredKeys;
    }

    public Set<String> requiredKeys() {
        return requiredKeys;
    }

    boolean accepts(String key) {
        return requiredKeys.contains(key);
    }

    abstract void validate(Map<String, Double> params);

    abstract Marginal createMarginal(Map<String, Double> params);

    abstract Map<String, Double> scale(Map<String, Double> params, double factor);

    /**
     * Presence, finiteness and family-specific checks; fails on the first offending parameter.
     */
    void check(Map<String, Double> params) {
        for (String key : requiredKeys) {
            if (!params.containsKey(key) || params.get(key) == null) {
                throw invalid(key, "is required");
            }
        }
        for (Map.Entry<String, Double> entry : params.entrySet()) {
            if (!accepts(entry.getKey())) {
                throw invalid(entry.getKey(), "is not a parameter of this distribution");
            }
            if (entry.getValue() == null || !Double.isFinite(entry.getValue())) {
                throw invalid(entry.getKey(), "must be a finite number, got " + entry.getValue());
            }
        }
        validate(params);
    }

    public static DistributionType fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new ConstructionValidationException("Distribution type is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConstructionValidationException("Unknown distribution type: " + value);
        }
    }

    ConstructionValidationException invalid(String parameter, String problem) {
        return new ConstructionValidationException(
                name() + " distribution parameter '" + parameter + "' " + problem);
    }

    void requirePositive(Map<String, Double> params, String key) {
        double value = params.get(key);
        if (value <= 0) {
            throw invalid(key, "must be > 0, got " + value);
        }
    }

    private static Map<String, Double> multiplyAll(Map<String, Double> params, double factor) {
        Map<String, Double> scaled = new LinkedHashMap<>();
        params.forEach((key, value) -> scaled.put(key, value * factor));
        return scaled;
    }

    private static int percentileOf(String key) {
        Matcher matcher = PERCENTILE_KEY.matcher(key);
        if (!matcher.matches()) {
            return -1;
        }
        int k = Integer.parseInt(matcher.group(1));
        return k <= 100 ? k : -1;
    }

    private static TreeMap<Integer, Double> table(Map<String, Double> params) {
        TreeMap<Integer, Double> table = new TreeMap<>();
        params.forEach((key, value) -> table.put(percentileOf(key), value));
        return table;
    }
}
