package com.ppm.backend.simulation;

/**
 * Per-iteration impact of one risk, kept for contribution ranking.
 */
public record RiskTrace(String riskId, String riskName, ImpactType impactType, double[] impacts) {

    public RiskTrace {
        impacts = impacts.clone();
    }

    @Override
    public double[] impacts() {
        return impacts.clone();
    }

    public int size() {
        return impacts.length;
    }
}
