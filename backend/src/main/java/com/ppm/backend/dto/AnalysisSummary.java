package com.ppm.backend.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class AnalysisSummary {
    private RiskLevel overallRiskLevel;
    private RiskLevel budgetRiskLevel;
    private RiskLevel scheduleRiskLevel;
    private RiskLevel resourceRiskLevel;
    private List<String> keyInsights;
    private double probabilityOfSuccess;
}
