package com.ppm.backend.simulation.analysis;

public record Interval(double confidenceLevel, double lowerBound, double upperBound) {

    public double width() {
        return upperBound - lowerBound;
    }
}
