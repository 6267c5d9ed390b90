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

@Entity
@Table(name = "resource_assignments")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceAssignment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_id", nullable = false)
    private Long projectId;

    @Column(name = "resource_name", nullable = false, length = 200)
    private String resourceName;

    @Column(name = "capacity_hours", nullable = false)
    private Double capacityHours;

    @Column(name = "allocated_hours", nullable = false)
    private Double allocatedHours;
}
