package com.ppm.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Risk register entry. Category, impact type and distribution type are stored as free text
 * and mapped when the entry is turned into a simulation input. Cost, schedule and resource
 * estimates are kept apart since each is in its own unit.
 */
@Entity
@Table(name = "project_risks")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectRisk {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_id", nullable = false)
    private Long projectId;

    @Column(name = "risk_code", nullable = false, length = 64)
    private String riskCode;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(length = 1000)
    private String description;

    @Column(length = 32)
    private String category;

    @Column(name = "impact_type", length = 16)
    private String impactType;

    @Column(name = "distribution_type", length = 16)
    private String distributionType;

    // cost estimate, project currency
    @Column(name = "cost_impact")
    private Double costImpact;

    @Column(name = "cost_low")
    private Double costLow;

    @Column(name = "cost_most_likely")
    private Double costMostLikely;

    @Column(name = "cost_high")
    private Double costHigh;

    @Column(name = "cost_mean")
    private Double costMean;

    @Column(name = "cost_std")
    private Double costStd;

    // schedule estimate, days
    @Column(name = "schedule_impact_days")
    private Double scheduleImpactDays;

    @Column(name = "schedule_low_days")
    private Double scheduleLowDays;

    @Column(name = "schedule_most_likely_days")
    private Double scheduleMostLikelyDays;

    @Column(name = "schedule_high_days")
    private Double scheduleHighDays;

    @Column(name = "schedule_mean_days")
    private Double scheduleMeanDays;

    @Column(name = "schedule_std_days")
    private Double scheduleStdDays;

    // resource estimate, hours
    @Column(name = "resource_impact_hours")
    private Double resourceImpactHours;

    @Column(name = "resource_low_hours")
    private Double resourceLowHours;

    @Column(name = "resource_most_likely_hours")
    private Double resourceMostLikelyHours;

    @Column(name = "resource_high_hours")
    private Double resourceHighHours;

    @Column(name = "resource_mean_hours")
    private Double resourceMeanHours;

    @Column(name = "resource_std_hours")
    private Double resourceStdHours;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RiskStatus status;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public enum RiskStatus { OPEN, MITIGATED, CLOSED }
}
