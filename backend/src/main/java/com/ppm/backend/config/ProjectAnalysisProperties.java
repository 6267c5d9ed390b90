package com.ppm.backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "analysis")
@Data
@Validated
public class ProjectAnalysisProperties {

    @DecimalMin("0.01")
    @DecimalMax("0.999")
    private double defaultConfidenceLevel = 0.95;

    private Budget budget = new Budget();
    private Schedule schedule = new Schedule();
    private Resources resources = new Resources();
    private Distribution distribution = new Distribution();

    @Data
    public static class Budget {
        @Positive
        private double highRiskThreshold = 0.70;

        @Positive
        private double mediumRiskThreshold = 0.50;

        @Positive
        private double varianceInsightPct = 10.0;
    }

    @Data
    public static class Schedule {
        @Positive
        private double highRiskThreshold = 0.70;

        @Positive
        private double mediumRiskThreshold = 0.50;
    }

    @Data
    public static class Resources {
        @Positive
        private double highUtilizationThreshold = 0.85;

        @Positive
        private double utilizationWarningThreshold = 0.90;

        @Positive
        private double conflictWarningThreshold = 0.30;

        @Positive
        private double highConflictThreshold = 0.60;

        @Positive
        private double mediumConflictThreshold = 0.30;

        @Positive
        private double conflictInsightThreshold = 0.50;
    }

    @Data
    public static class Distribution {
        @Positive
        private double normalStdRatio = 0.20;

        @Positive
        private double triangularMaxFactor = 2.0;
    }
}
