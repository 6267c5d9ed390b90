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

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "projects")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Project {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(name = "baseline_budget", nullable = false, precision = 19, scale = 4)
    private BigDecimal baselineBudget;

    @Column(name = "current_spend", nullable = false, precision = 19, scale = 4)
    private BigDecimal currentSpend;

    @Column(name = "contingency_reserve", nullable = false, precision = 19, scale = 4)
    private BigDecimal contingencyReserve;

    @Column(name = "baseline_duration_days", nullable = false)
    private Integer baselineDurationDays;

    @Column(name = "elapsed_days", nullable = false)
    private Integer elapsedDays;

    @Column(name = "schedule_buffer_days", nullable = false)
    private Integer scheduleBufferDays;

    @Column(name = "start_date")
    private LocalDate startDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ProjectStatus status;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public enum ProjectStatus { PLANNING, ACTIVE, ON_HOLD, COMPLETED, CANCELLED }
}
