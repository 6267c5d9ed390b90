package com.ppm.backend.service;

import com.ppm.backend.config.ProjectAnalysisProperties;
import com.ppm.backend.config.SimulationProperties;
import com.ppm.backend.dto.AnalysisSummary;
import com.ppm.backend.dto.BudgetVarianceAnalysis;
import com.ppm.backend.dto.HighUtilizationResource;
import com.ppm.backend.dto.ProjectRiskReport;
import com.ppm.backend.dto.ResourceRiskAnalysis;
import com.ppm.backend.dto.RiskLevel;
import com.ppm.backend.dto.ScheduleVarianceAnalysis;
import com.ppm.backend.exception.ProjectNotFoundException;
import com.ppm.backend.exception.SimulationPreconditionException;
import com.ppm.backend.service.risk.ProjectDataPort;
import com.ppm.backend.service.risk.ProjectDataPort.ImpactEstimate;
import com.ppm.backend.service.risk.ProjectDataPort.MilestoneRecord;
import com.ppm.backend.service.risk.ProjectDataPort.ProjectBaseline;
import com.ppm.backend.service.risk.ProjectDataPort.ResourceAllocation;
import com.ppm.backend.service.risk.ProjectDataPort.RiskRecord;
import com.ppm.backend.simulation.CorrelationInjector;
import com.ppm.backend.simulation.DistributionSampler;
import com.ppm.backend.simulation.MonteCarloEngine;
import com.ppm.backend.simulation.analysis.ResultsAnalyzer;
import com.ppm.backend.simulation.analysis.RiskContribution;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ProjectRiskAnalysisServiceTest {

    private static final Long PROJECT_ID = 7L;

    private ProjectDataPort projectDataPort;
    private AuditEventService auditEventService;
    private SimpleMeterRegistry meterRegistry;
    private SimulationProperties simulationProperties;
    private ProjectAnalysisProperties analysisProperties;

    @BeforeEach
    void setUp() {
        projectDataPort = mock(ProjectDataPort.class);
        auditEventService = mock(AuditEventService.class);
        meterRegistry = new SimpleMeterRegistry();
        simulationProperties = new SimulationProperties();
        simulationProperties.setMinIterations(1_000);
        simulationProperties.setDefaultIterations(2_000);
        analysisProperties = new ProjectAnalysisProperties();
        when(projectDataPort.findBaseline(PROJECT_ID)).thenReturn(Optional.of(baseline()));
        when(projectDataPort.riskRecords(PROJECT_ID)).thenReturn(List.of());
        when(projectDataPort.resourceAllocations(PROJECT_ID)).thenReturn(List.of());
        when(projectDataPort.milestones(PROJECT_ID)).thenReturn(List.of());
    }

    @Test
    void noBudgetRisksGiveCertainOutcomeWithoutSimulating() {
        MonteCarloEngine engine = mock(MonteCarloEngine.class);
        ProjectRiskAnalysisService service = service(engine);

        BudgetVarianceAnalysis analysis = service.analyzeBudgetVariance(PROJECT_ID);

        assertThat(analysis.getProbabilityWithinBudget()).isEqualTo(1.0);
        assertThat(analysis.getProbabilityWithin10Percent()).isEqualTo(1.0);
        assertThat(analysis.getExpectedFinalCost()).isEqualTo(100_000.0);
        assertThat(analysis.getVarianceFromBaseline()).isZero();
        assertThat(analysis.getRemainingBudget()).isEqualTo(60_000.0);
        assertThat(analysis.getTopRiskContributors()).isEmpty();
        assertThat(analysis.getPercentiles()).isNull();
        assertThat(analysis.getNote()).isEqualTo("No budget risks identified for analysis");
        verifyNoInteractions(engine);
        verify(auditEventService).recordAnalysis(eq(PROJECT_ID), eq("BUDGET_ANALYSIS"), isNull(), any(), anyMap());
        assertThat(meterRegistry.get("risk_analyses_total")
                .tag("dimension", "budget").tag("outcome", "degenerate").counter().count()).isEqualTo(1.0);
    }

    @Test
    void noResourceRisksReportInsufficientData() {
        MonteCarloEngine engine = mock(MonteCarloEngine.class);

        ResourceRiskAnalysis analysis = service(engine).analyzeResourceRisks(PROJECT_ID);

        assertThat(analysis.getConflictProbability()).isZero();
        assertThat(analysis.getProbabilityWithinCapacity()).isEqualTo(1.0);
        assertThat(analysis.getRecommendations()).containsExactly("Insufficient resource data for analysis");
        verifyNoInteractions(engine);
    }

    @Test
    void invalidRequestsFailBeforeAnyWork() {
        MonteCarloEngine engine = mock(MonteCarloEngine.class);
        ProjectRiskAnalysisService service = service(engine);

        assertThatThrownBy(() -> service.analyzeBudgetVariance(PROJECT_ID, -5, 0.95, null))
                .isInstanceOf(SimulationPreconditionException.class)
                .hasMessageContaining("-5");
        assertThatThrownBy(() -> service.analyzeScheduleVariance(PROJECT_ID, 2_000, 1.0, null))
                .isInstanceOf(SimulationPreconditionException.class);
        assertThatThrownBy(() -> service.analyzeResourceRisks(null, 2_000, 0.9, null))
                .isInstanceOf(SimulationPreconditionException.class);
        verifyNoInteractions(engine);
        verifyNoInteractions(projectDataPort);
    }

    @Test
    void unknownProjectIsReported() {
        when(projectDataPort.findBaseline(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service(mock(MonteCarloEngine.class)).analyzeProject(99L))
                .isInstanceOf(ProjectNotFoundException.class)
                .hasMessageContaining("99");
    }

    @Test
    void budgetAnalysisSimulatesCostRisks() {
        when(projectDataPort.riskRecords(PROJECT_ID)).thenReturn(List.of(
                triangular("R1", "cost", "cost", 0.0, 10_000.0, 20_000.0),
                triangular("R2", "schedule", "schedule", 0.0, 10.0, 20.0)));

        BudgetVarianceAnalysis analysis = service(realEngine()).analyzeBudgetVariance(PROJECT_ID, 4_000, 0.9, 11L);

        assertThat(analysis.getRiskCount()).isEqualTo(1);
        assertThat(analysis.getSimulationId()).isNotNull();
        assertThat(analysis.getExpectedFinalCost()).isCloseTo(110_000.0, within(300.0));
        assertThat(analysis.getVariancePercentage()).isCloseTo(10.0, within(0.3));
        assertThat(analysis.getProbabilityWithinBudget()).isCloseTo(0.5, within(0.04));
        assertThat(analysis.getProbabilityWithin10Percent()).isCloseTo(0.5, within(0.04));
        assertThat(analysis.getCostAtRiskP95()).isCloseTo(20_000.0 - Math.sqrt(0.1) * 10_000.0, within(400.0));
        assertThat(analysis.getRecommendedContingency()).isGreaterThan(analysis.getVarianceFromBaseline());
        assertThat(analysis.getPercentiles().mean()).isCloseTo(analysis.getExpectedFinalCost(), within(1e-6));
        assertThat(analysis.getConfidenceInterval().confidenceLevel()).isEqualTo(0.9);
        assertThat(analysis.getTopRiskContributors()).extracting(RiskContribution::riskId).containsExactly("R1");
        assertThat(meterRegistry.get("risk_simulation_seconds").timer().count()).isEqualTo(1L);
    }

    @Test
    void scheduleAnalysisIncludesBufferAndCriticalPath() {
        when(projectDataPort.riskRecords(PROJECT_ID)).thenReturn(List.of(
                triangular("R1", "schedule", "schedule", 0.0, 10.0, 20.0)));
        when(projectDataPort.milestones(PROJECT_ID)).thenReturn(List.of(
                new MilestoneRecord("1", "Design sign-off", LocalDate.of(2026, 3, 1), 30.0, true, true),
                new MilestoneRecord("2", "Go-live", LocalDate.of(2026, 9, 1), 70.0, true, false),
                new MilestoneRecord("3", "Training", LocalDate.of(2026, 8, 1), 10.0, false, false)));

        ScheduleVarianceAnalysis analysis = service(realEngine()).analyzeScheduleVariance(PROJECT_ID, 4_000, 0.95, 3L);

        assertThat(analysis.getProbabilityOnTime()).isCloseTo(0.5, within(0.04));
        assertThat(analysis.getProbabilityWithinOneWeek()).isCloseTo(0.955, within(0.02));
        assertThat(analysis.getProbabilityWithinOneMonth()).isEqualTo(1.0);
        assertThat(analysis.getExpectedFinalDuration()).isCloseTo(110.0, within(0.5));
        assertThat(analysis.getCriticalPathAnalysis().isCriticalPathIdentified()).isTrue();
        assertThat(analysis.getCriticalPathAnalysis().getCriticalMilestones()).isEqualTo(2);
        assertThat(analysis.getCriticalPathAnalysis().getOpenCriticalMilestones()).isEqualTo(1);
        assertThat(analysis.getCriticalPathAnalysis().getDelayRisk()).isCloseTo(0.1, within(0.005));
    }

    @Test
    void costAndScheduleRecordUsesEachDimensionsOwnEstimate() {
        when(projectDataPort.riskRecords(PROJECT_ID)).thenReturn(List.of(
                costAndSchedule("R1", triangularEstimate(5_000.0, 30_000.0, 90_000.0),
                        triangularEstimate(2.0, 5.0, 14.0))));
        ProjectRiskAnalysisService service = service(realEngine());

        ScheduleVarianceAnalysis schedule = service.analyzeScheduleVariance(PROJECT_ID, 2_000, 0.9, 2024L);
        BudgetVarianceAnalysis budget = service.analyzeBudgetVariance(PROJECT_ID, 2_000, 0.9, 2024L);

        assertThat(schedule.getRiskCount()).isEqualTo(1);
        assertThat(schedule.getExpectedFinalDuration()).isCloseTo(107.0, within(0.5));
        assertThat(schedule.getPercentiles().max()).isLessThanOrEqualTo(114.0);
        assertThat(schedule.getProbabilityWithinOneMonth()).isEqualTo(1.0);
        assertThat(budget.getExpectedFinalCost()).isCloseTo(100_000.0 + 125_000.0 / 3.0, within(1_500.0));
    }

    @Test
    void costAndScheduleRecordWithoutScheduleEstimateStaysOutOfSchedule() {
        when(projectDataPort.riskRecords(PROJECT_ID)).thenReturn(List.of(
                costAndSchedule("R1", triangularEstimate(5_000.0, 30_000.0, 90_000.0), null)));
        MonteCarloEngine engine = mock(MonteCarloEngine.class);

        ScheduleVarianceAnalysis schedule = service(engine).analyzeScheduleVariance(PROJECT_ID, 2_000, 0.9, 2024L);

        assertThat(schedule.getRiskCount()).isZero();
        assertThat(schedule.getExpectedFinalDuration()).isEqualTo(100.0);
        verifyNoInteractions(engine);
    }

    @Test
    void resourceAnalysisComparesExtraDemandWithSpareCapacity() {
        when(projectDataPort.riskRecords(PROJECT_ID)).thenReturn(List.of(
                triangular("R1", "resource", "schedule", 0.0, 40.0, 80.0),
                triangular("R2", "cost", "cost", 0.0, 5_000.0, 10_000.0)));
        when(projectDataPort.resourceAllocations(PROJECT_ID)).thenReturn(List.of(
                new ResourceAllocation("1", "Architect", 100.0, 95.0),
                new ResourceAllocation("2", "Developer", 100.0, 50.0)));

        ResourceRiskAnalysis analysis = service(realEngine()).analyzeResourceRisks(PROJECT_ID, 4_000, 0.95, 5L);

        assertThat(analysis.getRiskCount()).isEqualTo(1);
        assertThat(analysis.getSpareCapacity()).isEqualTo(55.0);
        assertThat(analysis.getUtilizationRate()).isCloseTo(0.725, within(1e-9));
        assertThat(analysis.getHighUtilizationResources()).extracting(HighUtilizationResource::resourceName)
                .containsExactly("Architect");
        assertThat(analysis.getHighUtilizationShare()).isEqualTo(0.5);
        assertThat(analysis.getConflictProbability()).isCloseTo(625.0 / 3200.0, within(0.03));
        assertThat(analysis.getProbabilityWithinCapacity())
                .isCloseTo(1.0 - analysis.getConflictProbability(), within(1e-12));
        assertThat(analysis.getRecommendations())
                .containsExactly("Critical resources requiring attention: Architect");
    }

    @Test
    void projectReportIsReproducibleForAGivenSeed() {
        when(projectDataPort.riskRecords(PROJECT_ID)).thenReturn(List.of(
                triangular("R1", "cost", "cost", 20_000.0, 40_000.0, 60_000.0),
                costAndSchedule("R2", triangularEstimate(0.0, 5_000.0, 10_000.0),
                        triangularEstimate(0.0, 10.0, 20.0)),
                triangular("R3", "resource", "schedule", 50.0, 100.0, 150.0)));
        when(projectDataPort.resourceAllocations(PROJECT_ID)).thenReturn(List.of(
                new ResourceAllocation("1", "Architect", 100.0, 95.0)));
        ProjectRiskAnalysisService service = service(realEngine());

        ProjectRiskReport first = service.analyzeProject(PROJECT_ID, 2_000, 0.95, 21L);
        ProjectRiskReport second = service.analyzeProject(PROJECT_ID, 2_000, 0.95, 21L);

        assertThat(first.getProjectName()).isEqualTo("ERP rollout");
        assertThat(first.getBudget().getExpectedFinalCost()).isEqualTo(second.getBudget().getExpectedFinalCost());
        assertThat(first.getSchedule().getProbabilityOnTime()).isEqualTo(second.getSchedule().getProbabilityOnTime());
        assertThat(first.getResources().getConflictProbability())
                .isEqualTo(second.getResources().getConflictProbability());

        AnalysisSummary summary = first.getSummary();
        assertThat(summary.getBudgetRiskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(summary.getResourceRiskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(summary.getOverallRiskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(summary.getKeyInsights()).contains("High probability of resource conflicts detected");
        assertThat(summary.getKeyInsights()).anyMatch(insight -> insight.startsWith("Budget variance of"));
        assertThat(summary.getProbabilityOfSuccess()).isEqualTo(Math.min(
                first.getBudget().getProbabilityWithinBudget(), first.getSchedule().getProbabilityOnTime()));
    }

    @Test
    void resourceRecommendationsCoverEveryTrigger() {
        ProjectRiskAnalysisService service = service(mock(MonteCarloEngine.class));
        List<HighUtilizationResource> busy = List.of(
                new HighUtilizationResource("1", "A", 0.95, 10, 9.5),
                new HighUtilizationResource("2", "B", 0.9, 10, 9),
                new HighUtilizationResource("3", "C", 0.9, 10, 9),
                new HighUtilizationResource("4", "D", 0.88, 10, 8.8));

        List<String> recommendations = service.resourceRecommendations(0.95, 0.42, busy);

        assertThat(recommendations).containsExactly(
                "High resource utilization detected (>90%). Consider adding buffer capacity or adjusting timeline.",
                "Resource conflict risk is elevated (42.0%). Review resource allocation for 4 high-risk resources.",
                "Critical resources requiring attention: A, B, C");
        assertThat(service.resourceRecommendations(0.5, 0.1, List.of()))
                .containsExactly("Resource allocation appears balanced. Continue monitoring utilization trends.");
    }

    @Test
    void summaryLevelsFollowThresholds() {
        ProjectRiskAnalysisService service = service(mock(MonteCarloEngine.class));

        AnalysisSummary summary = service.summarize(
                BudgetVarianceAnalysis.builder().probabilityWithinBudget(0.8).variancePercentage(12.0).build(),
                ScheduleVarianceAnalysis.builder().probabilityOnTime(0.6).variancePercentage(4.0).build(),
                ResourceRiskAnalysis.builder().conflictProbability(0.1).build());

        assertThat(summary.getBudgetRiskLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(summary.getScheduleRiskLevel()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(summary.getResourceRiskLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(summary.getOverallRiskLevel()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(summary.getKeyInsights()).containsExactly("Budget variance of 12.0% exceeds threshold");
        assertThat(summary.getProbabilityOfSuccess()).isEqualTo(0.6);
    }

    private ProjectRiskAnalysisService service(MonteCarloEngine engine) {
        SimulationMetricsService metrics = new SimulationMetricsService(meterRegistry);
        metrics.init();
        return new ProjectRiskAnalysisService(projectDataPort, engine, new ResultsAnalyzer(simulationProperties),
                simulationProperties, analysisProperties, auditEventService, metrics);
    }

    private MonteCarloEngine realEngine() {
        DistributionSampler sampler = new DistributionSampler();
        return new MonteCarloEngine(simulationProperties, sampler, new CorrelationInjector(sampler));
    }

    private static ProjectBaseline baseline() {
        return new ProjectBaseline(PROJECT_ID, "ERP rollout", 100_000.0, 40_000.0, 10_000.0, 100.0, 30.0, 10.0);
    }

    private static RiskRecord triangular(String id, String category, String impactType,
                                         double low, double mostLikely, double high) {
        ImpactEstimate estimate = triangularEstimate(low, mostLikely, high);
        boolean resource = "resource".equals(category);
        return new RiskRecord(id, "Risk " + id, category, impactType, "triangular",
                !resource && "cost".equals(impactType) ? estimate : null,
                !resource && "schedule".equals(impactType) ? estimate : null,
                resource ? estimate : null);
    }

    private static RiskRecord costAndSchedule(String id, ImpactEstimate cost, ImpactEstimate schedule) {
        return new RiskRecord(id, "Risk " + id, "technical", "both", "triangular", cost, schedule, null);
    }

    private static ImpactEstimate triangularEstimate(double low, double mostLikely, double high) {
        return new ImpactEstimate(mostLikely, low, mostLikely, high, null, null);
    }
}
