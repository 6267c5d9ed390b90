package com.ppm.backend.simulation;

import com.ppm.backend.exception.ConstructionValidationException;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Sparse pairwise correlation coefficients over a fixed list of participating risk ids.
 * Pairs that are not listed are uncorrelated.
 */
@ToString
@EqualsAndHashCode
public final class CorrelationMatrix {

    private final List<String> riskIds;
    private final Map<RiskPair, Double> coefficients;

    private CorrelationMatrix(List<String> riskIds, Map<RiskPair, Double> coefficients) {
        this.riskIds = List.copyOf(riskIds);
        this.coefficients = Collections.unmodifiableMap(new LinkedHashMap<>(coefficients));
    }

    public static Builder builder(Collection<String> riskIds) {
        return new Builder(riskIds);
    }

    public List<String> getRiskIds() {
        return riskIds;
    }

    public Map<RiskPair, Double> getCoefficients() {
        return coefficients;
    }

    public boolean isEmpty() {
        return coefficients.isEmpty();
    }

    public double coefficient(String a, String b) {
        if (a.equals(b)) {
            return 1.0;
        }
        return coefficients.getOrDefault(RiskPair.of(a, b), 0.0);
    }

    /**
     * Dense symmetric matrix over {@code order}, unit diagonal.
     */
    public double[][] toDense(List<String> order) {
        int n = order.size();
        double[][] dense = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                dense[i][j] = coefficient(order.get(i), order.get(j));
            }
        }
        return dense;
    }

    public static final class Builder {

        private final Set<String> riskIds = new LinkedHashSet<>();
        private final Map<RiskPair, Double> coefficients = new LinkedHashMap<>();

        private Builder(Collection<String> ids) {
            if (ids == null || ids.isEmpty()) {
                throw new ConstructionValidationException("Correlation matrix requires at least one risk id");
            }
            for (String id : ids) {
                if (id == null || id.isBlank()) {
                    throw new ConstructionValidationException("Correlation matrix risk ids must not be blank");
                }
                if (!riskIds.add(id)) {
                    throw new ConstructionValidationException("Correlation matrix lists risk '" + id + "' twice");
                }
            }
        }

        public Builder correlate(String a, String b, double coefficient) {
            if (!Double.isFinite(coefficient) || coefficient < -1.0 || coefficient > 1.0) {
                throw new ConstructionValidationException(
                        "Correlation between '" + a + "' and '" + b + "' must be within [-1, 1], got " + coefficient);
            }
            RiskPair pair = RiskPair.of(a, b);
            if (!riskIds.contains(pair.first()) || !riskIds.contains(pair.second())) {
                throw new ConstructionValidationException(
                        "Correlation pair " + pair + " names a risk outside " + riskIds);
            }
            Double existing = coefficients.get(pair);
            if (existing != null && Double.compare(existing, coefficient) != 0) {
                throw new ConstructionValidationException("Correlation pair " + pair + " supplied twice with "
                        + existing + " and " + coefficient);
            }
            coefficients.put(pair, coefficient);
            return this;
        }

        public CorrelationMatrix build() {
            return new CorrelationMatrix(List.copyOf(riskIds), coefficients);
        }
    }
}
