package com.ppm.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Entity
@Table(name = "project_milestones")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectMilestone {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_id", nullable = false)
    private Long projectId;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(name = "planned_date")
    private LocalDate plannedDate;

    @Column(name = "baseline_duration_days")
    private Integer baselineDurationDays;

    @Column(name = "critical_path", nullable = false)
    private boolean criticalPath;

    @Column(nullable = false)
    private boolean completed;
}
