package com.ppm.backend.dto;

import com.ppm.backend.simulation.analysis.Interval;
import com.ppm.backend.simulation.analysis.OutcomeStatistics;
import com.ppm.backend.simulation.analysis.RiskContribution;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class ScheduleVarianceAnalysis {
    private Long projectId;

    // Durations in days
    private double baselineDurationDays;
    private double elapsedDays;
    private double remainingDurationDays;
    private double scheduleBufferDays;

    private double expectedFinalDuration;
    private double varianceFromBaseline;
    private double variancePercentage;
    private double probabilityOnTime;
    private double probabilityWithinOneWeek;
    private double probabilityWithinOneMonth;
    private double durationAtRiskP95;

    private OutcomeStatistics percentiles;
    private Interval confidenceInterval;
    private List<RiskContribution> topRiskContributors;
    private CriticalPathAnalysis criticalPathAnalysis;

    private int riskCount;
    private String simulationId;
    private String note;
}
