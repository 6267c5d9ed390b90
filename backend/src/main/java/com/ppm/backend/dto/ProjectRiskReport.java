package com.ppm.backend.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class ProjectRiskReport {
    private Long projectId;
    private String projectName;
    private int iterations;
    private double confidenceLevel;
    private BudgetVarianceAnalysis budget;
    private ScheduleVarianceAnalysis schedule;
    private ResourceRiskAnalysis resources;
    private AnalysisSummary summary;
    private Instant generatedAt;
}
