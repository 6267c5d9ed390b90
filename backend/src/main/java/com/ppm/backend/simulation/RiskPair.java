package com.ppm.backend.simulation;

import com.ppm.backend.exception.ConstructionValidationException;

/**
 * Unordered pair of risk ids, stored with the lexicographically smaller id first.
 */
public record RiskPair(String first, String second) {

    public RiskPair {
        if (first == null || second == null || first.isBlank() || second.isBlank()) {
            throw new ConstructionValidationException("Correlation pair requires two risk ids");
        }
        if (first.equals(second)) {
            throw new ConstructionValidationException("Risk '" + first + "' cannot be correlated with itself");
        }
        if (first.compareTo(second) > 0) {
            String swap = first;
            first = second;
            second = swap;
        }
    }

    public static RiskPair of(String a, String b) {
        return new RiskPair(a, b);
    }
}
