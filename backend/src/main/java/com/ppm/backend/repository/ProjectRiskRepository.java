package com.ppm.backend.repository;

import com.ppm.backend.model.ProjectRisk;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface ProjectRiskRepository extends JpaRepository<ProjectRisk, Long> {

    List<ProjectRisk> findByProjectIdAndStatusInOrderByRiskCodeAsc(Long projectId, Collection<ProjectRisk.RiskStatus> statuses);
}
