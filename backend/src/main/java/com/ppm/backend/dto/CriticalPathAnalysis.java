package com.ppm.backend.dto;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.util.List;

@Data
@Builder
public class CriticalPathAnalysis {
    private boolean criticalPathIdentified;
    private int criticalMilestones;
    private int openCriticalMilestones;
    private double delayRisk;
    private List<MilestoneDetail> milestoneDetails;

    public record MilestoneDetail(String id, String name, LocalDate plannedDate, double baselineDurationDays,
                                  boolean completed) {}
}
