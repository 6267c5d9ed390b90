package com.ppm.backend.service.risk;

import com.ppm.backend.model.Project;
import com.ppm.backend.model.ProjectRisk;
import com.ppm.backend.repository.ProjectMilestoneRepository;
import com.ppm.backend.repository.ProjectRepository;
import com.ppm.backend.repository.ProjectRiskRepository;
import com.ppm.backend.repository.ResourceAssignmentRepository;
import com.ppm.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaProjectDataPort implements ProjectDataPort {

    private final ProjectRepository projectRepository;
    private final ProjectRiskRepository projectRiskRepository;
    private final ResourceAssignmentRepository resourceAssignmentRepository;
    private final ProjectMilestoneRepository projectMilestoneRepository;

    @Override
    public Optional<ProjectBaseline> findBaseline(Long projectId) {
        return projectRepository.findById(projectId).map(this::toBaseline);
    }

    @Override
    public List<RiskRecord> riskRecords(Long projectId) {
        return projectRiskRepository.findByProjectIdAndStatusInOrderByRiskCodeAsc(
                        projectId, EnumSet.of(ProjectRisk.RiskStatus.OPEN, ProjectRisk.RiskStatus.MITIGATED))
                .stream()
                .map(this::toRecord)
                .toList();
    }

    @Override
    public List<ResourceAllocation> resourceAllocations(Long projectId) {
        return resourceAssignmentRepository.findByProjectIdOrderByResourceNameAsc(projectId).stream()
                .map(assignment -> new ResourceAllocation(
                        String.valueOf(assignment.getId()),
                        assignment.getResourceName(),
                        valueOrZero(assignment.getCapacityHours()),
                        valueOrZero(assignment.getAllocatedHours())))
                .toList();
    }

    @Override
    public List<MilestoneRecord> milestones(Long projectId) {
        return projectMilestoneRepository.findByProjectIdOrderByPlannedDateAsc(projectId).stream()
                .map(milestone -> new MilestoneRecord(
                        String.valueOf(milestone.getId()),
                        milestone.getName(),
                        milestone.getPlannedDate(),
                        milestone.getBaselineDurationDays() == null ? 0.0 : milestone.getBaselineDurationDays(),
                        milestone.isCriticalPath(),
                        milestone.isCompleted()))
                .toList();
    }

    private RiskRecord toRecord(ProjectRisk risk) {
        return new RiskRecord(
                risk.getRiskCode(),
                risk.getTitle(),
                risk.getCategory(),
                risk.getImpactType(),
                risk.getDistributionType(),
                estimate(risk.getCostImpact(), risk.getCostLow(), risk.getCostMostLikely(),
                        risk.getCostHigh(), risk.getCostMean(), risk.getCostStd()),
                estimate(risk.getScheduleImpactDays(), risk.getScheduleLowDays(), risk.getScheduleMostLikelyDays(),
                        risk.getScheduleHighDays(), risk.getScheduleMeanDays(), risk.getScheduleStdDays()),
                estimate(risk.getResourceImpactHours(), risk.getResourceLowHours(),
                        risk.getResourceMostLikelyHours(), risk.getResourceHighHours(),
                        risk.getResourceMeanHours(), risk.getResourceStdHours()));
    }

    private static ImpactEstimate estimate(Double baseline, Double low, Double mostLikely,
                                           Double high, Double mean, Double std) {
        ImpactEstimate estimate = new ImpactEstimate(baseline, low, mostLikely, high, mean, std);
        return estimate.isEmpty() ? null : estimate;
    }

    private ProjectBaseline toBaseline(Project project) {
        return new ProjectBaseline(
                project.getId(),
                project.getName(),
                MoneyUtils.toDouble(project.getBaselineBudget()),
                MoneyUtils.toDouble(project.getCurrentSpend()),
                MoneyUtils.toDouble(project.getContingencyReserve()),
                intOrZero(project.getBaselineDurationDays()),
                intOrZero(project.getElapsedDays()),
                intOrZero(project.getScheduleBufferDays()));
    }

    private static double valueOrZero(Double value) {
        return value == null ? 0.0 : value;
    }

    private static double intOrZero(Integer value) {
        return value == null ? 0.0 : value;
    }
}
