package com.ppm.backend.dto;

import com.ppm.backend.simulation.analysis.RiskContribution;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class ResourceRiskAnalysis {
    private Long projectId;

    // Capacity and allocation in hours
    private int totalResources;
    private double totalCapacity;
    private double totalAllocated;
    private double spareCapacity;
    private double utilizationRate;
    private List<HighUtilizationResource> highUtilizationResources;
    private double highUtilizationShare;

    // Simulated extra demand from resource risks against spare capacity
    private double expectedExtraDemand;
    private double conflictProbability;
    private double probabilityWithinCapacity;

    private List<RiskContribution> topRiskContributors;
    private List<String> recommendations;

    private int riskCount;
    private String simulationId;
    private String note;
}
