package com.ppm.backend.simulation.analysis;

import com.ppm.backend.simulation.OutcomeType;

import java.util.List;
import java.util.Optional;

public record ConfidenceIntervals(OutcomeType outcomeType, List<Interval> intervals) {

    public ConfidenceIntervals {
        intervals = List.copyOf(intervals);
    }

    public Optional<Interval> forLevel(double confidenceLevel) {
        return intervals.stream()
                .filter(interval -> Double.compare(interval.confidenceLevel(), confidenceLevel) == 0)
                .findFirst();
    }
}
