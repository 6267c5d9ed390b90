package com.ppm.backend.service;

import com.ppm.backend.config.ProjectAnalysisProperties;
import com.ppm.backend.config.SimulationProperties;
import com.ppm.backend.dto.AnalysisSummary;
import com.ppm.backend.dto.BudgetVarianceAnalysis;
import com.ppm.backend.dto.CriticalPathAnalysis;
import com.ppm.backend.dto.HighUtilizationResource;
import com.ppm.backend.dto.ProjectRiskReport;
import com.ppm.backend.dto.ResourceRiskAnalysis;
import com.ppm.backend.dto.RiskLevel;
import com.ppm.backend.dto.ScheduleVarianceAnalysis;
import com.ppm.backend.exception.ProjectNotFoundException;
import com.ppm.backend.exception.SimulationPreconditionException;
import com.ppm.backend.service.risk.ProjectDataPort;
import com.ppm.backend.service.risk.ProjectDataPort.MilestoneRecord;
import com.ppm.backend.service.risk.ProjectDataPort.ProjectBaseline;
import com.ppm.backend.service.risk.ProjectDataPort.ResourceAllocation;
import com.ppm.backend.service.risk.ProjectDataPort.RiskRecord;
import com.ppm.backend.service.risk.RiskRecordTranslator;
import com.ppm.backend.simulation.MonteCarloEngine;
import com.ppm.backend.simulation.OutcomeType;
import com.ppm.backend.simulation.Risk;
import com.ppm.backend.simulation.RiskTrace;
import com.ppm.backend.simulation.SimulationResults;
import com.ppm.backend.simulation.analysis.Interval;
import com.ppm.backend.simulation.analysis.ResultsAnalyzer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.DoublePredicate;

/**
 * Budget, schedule and resource risk analysis of a stored project. Records are read through
 * {@link ProjectDataPort} before any simulation starts; a dimension without qualifying risks
 * gets a fixed "no risk" result and the engine is not called for it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectRiskAnalysisService {

    static final String BUDGET = "budget";
    static final String SCHEDULE = "schedule";
    static final String RESOURCES = "resources";

    private static final double DAYS_IN_WEEK = 7.0;
    private static final double DAYS_IN_MONTH = 30.0;

    private final ProjectDataPort projectDataPort;
    private final MonteCarloEngine engine;
    private final ResultsAnalyzer analyzer;
    private final SimulationProperties simulationProperties;
    private final ProjectAnalysisProperties analysisProperties;
    private final AuditEventService auditEventService;
    private final SimulationMetricsService metricsService;

    public BudgetVarianceAnalysis analyzeBudgetVariance(Long projectId) {
        return analyzeBudgetVariance(projectId, simulationProperties.getDefaultIterations(),
                analysisProperties.getDefaultConfidenceLevel(), null);
    }

    public BudgetVarianceAnalysis analyzeBudgetVariance(Long projectId, int iterations, double confidenceLevel, Long seed) {
        validateRequest(projectId, iterations, confidenceLevel);
        try (MDC.MDCCloseable ignored = MDC.putCloseable("projectId", String.valueOf(projectId))) {
            ProjectBaseline baseline = loadBaseline(projectId);
            return budget(baseline, projectDataPort.riskRecords(projectId), iterations, confidenceLevel, seed);
        }
    }

    public ScheduleVarianceAnalysis analyzeScheduleVariance(Long projectId) {
        return analyzeScheduleVariance(projectId, simulationProperties.getDefaultIterations(),
                analysisProperties.getDefaultConfidenceLevel(), null);
    }

    public ScheduleVarianceAnalysis analyzeScheduleVariance(Long projectId, int iterations, double confidenceLevel, Long seed) {
        validateRequest(projectId, iterations, confidenceLevel);
        try (MDC.MDCCloseable ignored = MDC.putCloseable("projectId", String.valueOf(projectId))) {
            ProjectBaseline baseline = loadBaseline(projectId);
            return schedule(baseline, projectDataPort.riskRecords(projectId), projectDataPort.milestones(projectId),
                    iterations, confidenceLevel, seed);
        }
    }

    public ResourceRiskAnalysis analyzeResourceRisks(Long projectId) {
        return analyzeResourceRisks(projectId, simulationProperties.getDefaultIterations(),
                analysisProperties.getDefaultConfidenceLevel(), null);
    }

    public ResourceRiskAnalysis analyzeResourceRisks(Long projectId, int iterations, double confidenceLevel, Long seed) {
        validateRequest(projectId, iterations, confidenceLevel);
        try (MDC.MDCCloseable ignored = MDC.putCloseable("projectId", String.valueOf(projectId))) {
            loadBaseline(projectId);
            return resources(projectId, projectDataPort.riskRecords(projectId),
                    projectDataPort.resourceAllocations(projectId), iterations, seed);
        }
    }

    /**
     * All three dimensions plus an executive summary. A given seed drives the three runs as
     * seed, seed + 1 and seed + 2.
     */
    public ProjectRiskReport analyzeProject(Long projectId, int iterations, double confidenceLevel, Long seed) {
        validateRequest(projectId, iterations, confidenceLevel);
        try (MDC.MDCCloseable ignored = MDC.putCloseable("projectId", String.valueOf(projectId))) {
            ProjectBaseline baseline = loadBaseline(projectId);
            List<RiskRecord> records = projectDataPort.riskRecords(projectId);
            log.info("Running full risk analysis for project {} ({} risk records)", projectId, records.size());

            BudgetVarianceAnalysis budget = budget(baseline, records, iterations, confidenceLevel, seed);
            ScheduleVarianceAnalysis schedule = schedule(baseline, records, projectDataPort.milestones(projectId),
                    iterations, confidenceLevel, seed == null ? null : seed + 1);
            ResourceRiskAnalysis resources = resources(projectId, records,
                    projectDataPort.resourceAllocations(projectId), iterations, seed == null ? null : seed + 2);

            return ProjectRiskReport.builder()
                    .projectId(projectId)
                    .projectName(baseline.name())
                    .iterations(iterations)
                    .confidenceLevel(confidenceLevel)
                    .budget(budget)
                    .schedule(schedule)
                    .resources(resources)
                    .summary(summarize(budget, schedule, resources))
                    .generatedAt(Instant.now())
                    .build();
        }
    }

    public ProjectRiskReport analyzeProject(Long projectId) {
        return analyzeProject(projectId, simulationProperties.getDefaultIterations(),
                analysisProperties.getDefaultConfidenceLevel(), null);
    }

    private BudgetVarianceAnalysis budget(ProjectBaseline baseline, List<RiskRecord> records,
                                          int iterations, double confidenceLevel, Long seed) {
        List<Risk> risks = translator().budgetRisks(records);
        double baselineBudget = baseline.baselineBudget();
        BudgetVarianceAnalysis.BudgetVarianceAnalysisBuilder builder = BudgetVarianceAnalysis.builder()
                .projectId(baseline.projectId())
                .baselineBudget(baselineBudget)
                .currentSpend(baseline.currentSpend())
                .remainingBudget(baselineBudget - baseline.currentSpend())
                .contingencyReserve(baseline.contingencyReserve())
                .riskCount(risks.size());

        if (risks.isEmpty()) {
            log.warn("No budget risks found for project {}", baseline.projectId());
            BudgetVarianceAnalysis result = builder
                    .expectedFinalCost(baselineBudget)
                    .varianceFromBaseline(0.0)
                    .variancePercentage(0.0)
                    .probabilityWithinBudget(1.0)
                    .probabilityWithin10Percent(1.0)
                    .costAtRiskP95(0.0)
                    .recommendedContingency(0.0)
                    .topRiskContributors(List.of())
                    .note("No budget risks identified for analysis")
                    .build();
            finish(baseline.projectId(), BUDGET, null, 0, Map.of("probabilityWithinBudget", 1.0));
            return result;
        }

        SimulationResults results = engine.runSimulation(risks, iterations, seed);
        double[] impacts = results.getCostOutcomes();
        double[] finalCosts = shift(impacts, baselineBudget);
        double meanImpact = mean(impacts);
        double contingency = baseline.contingencyReserve();
        double withinBudget = fraction(impacts, impact -> impact <= contingency);

        BudgetVarianceAnalysis result = builder
                .expectedFinalCost(baselineBudget + meanImpact)
                .varianceFromBaseline(meanImpact)
                .variancePercentage(percentOf(meanImpact, baselineBudget))
                .probabilityWithinBudget(withinBudget)
                .probabilityWithin10Percent(fraction(finalCosts, cost -> cost <= baselineBudget * 1.1))
                .costAtRiskP95(analyzer.quantile(impacts, 95.0))
                .recommendedContingency(Math.max(0.0, analyzer.quantile(impacts, confidenceLevel * 100.0)))
                .percentiles(analyzer.describe(finalCosts))
                .confidenceInterval(interval(OutcomeType.COST, finalCosts, confidenceLevel))
                .topRiskContributors(analyzer.identifyTopRiskContributors(results))
                .simulationId(results.getSimulationId())
                .build();
        metricsService.recordSimulation(results.getExecutionTime());
        finish(baseline.projectId(), BUDGET, results.getSimulationId(), risks.size(),
                Map.of("probabilityWithinBudget", withinBudget, "iterations", iterations));
        return result;
    }

    private ScheduleVarianceAnalysis schedule(ProjectBaseline baseline, List<RiskRecord> records,
                                              List<MilestoneRecord> milestones,
                                              int iterations, double confidenceLevel, Long seed) {
        List<Risk> risks = translator().scheduleRisks(records);
        double baselineDuration = baseline.baselineDurationDays();
        ScheduleVarianceAnalysis.ScheduleVarianceAnalysisBuilder builder = ScheduleVarianceAnalysis.builder()
                .projectId(baseline.projectId())
                .baselineDurationDays(baselineDuration)
                .elapsedDays(baseline.elapsedDays())
                .remainingDurationDays(baselineDuration - baseline.elapsedDays())
                .scheduleBufferDays(baseline.scheduleBufferDays())
                .riskCount(risks.size());

        if (risks.isEmpty()) {
            log.warn("No schedule risks found for project {}", baseline.projectId());
            ScheduleVarianceAnalysis result = builder
                    .expectedFinalDuration(baselineDuration)
                    .varianceFromBaseline(0.0)
                    .variancePercentage(0.0)
                    .probabilityOnTime(1.0)
                    .probabilityWithinOneWeek(1.0)
                    .probabilityWithinOneMonth(1.0)
                    .durationAtRiskP95(0.0)
                    .topRiskContributors(List.of())
                    .criticalPathAnalysis(criticalPath(milestones, 0.0, baselineDuration))
                    .note("No schedule risks identified for analysis")
                    .build();
            finish(baseline.projectId(), SCHEDULE, null, 0, Map.of("probabilityOnTime", 1.0));
            return result;
        }

        SimulationResults results = engine.runSimulation(risks, iterations, seed);
        double[] delays = results.getScheduleOutcomes();
        double[] finalDurations = shift(delays, baselineDuration);
        double meanDelay = mean(delays);
        double buffer = baseline.scheduleBufferDays();
        double onTime = fraction(delays, delay -> delay <= buffer);

        ScheduleVarianceAnalysis result = builder
                .expectedFinalDuration(baselineDuration + meanDelay)
                .varianceFromBaseline(meanDelay)
                .variancePercentage(percentOf(meanDelay, baselineDuration))
                .probabilityOnTime(onTime)
                .probabilityWithinOneWeek(fraction(delays, delay -> delay <= buffer + DAYS_IN_WEEK))
                .probabilityWithinOneMonth(fraction(delays, delay -> delay <= buffer + DAYS_IN_MONTH))
                .durationAtRiskP95(analyzer.quantile(delays, 95.0))
                .percentiles(analyzer.describe(finalDurations))
                .confidenceInterval(interval(OutcomeType.SCHEDULE, finalDurations, confidenceLevel))
                .topRiskContributors(analyzer.identifyTopRiskContributors(results))
                .criticalPathAnalysis(criticalPath(milestones, meanDelay, baselineDuration))
                .simulationId(results.getSimulationId())
                .build();
        metricsService.recordSimulation(results.getExecutionTime());
        finish(baseline.projectId(), SCHEDULE, results.getSimulationId(), risks.size(),
                Map.of("probabilityOnTime", onTime, "iterations", iterations));
        return result;
    }

    private ResourceRiskAnalysis resources(Long projectId, List<RiskRecord> records,
                                           List<ResourceAllocation> allocations, int iterations, Long seed) {
        ProjectAnalysisProperties.Resources thresholds = analysisProperties.getResources();
        double totalCapacity = allocations.stream().mapToDouble(ResourceAllocation::capacity).sum();
        double totalAllocated = allocations.stream().mapToDouble(ResourceAllocation::allocated).sum();
        double utilization = totalCapacity > 0 ? totalAllocated / totalCapacity : 0.0;
        double spare = totalCapacity - totalAllocated;

        List<HighUtilizationResource> highUtilization = new ArrayList<>();
        for (ResourceAllocation allocation : allocations) {
            if (allocation.capacity() > 0
                    && allocation.allocated() / allocation.capacity() > thresholds.getHighUtilizationThreshold()) {
                highUtilization.add(new HighUtilizationResource(allocation.id(), allocation.name(),
                        allocation.allocated() / allocation.capacity(), allocation.capacity(), allocation.allocated()));
            }
        }

        List<Risk> risks = translator().resourceRisks(records);
        ResourceRiskAnalysis.ResourceRiskAnalysisBuilder builder = ResourceRiskAnalysis.builder()
                .projectId(projectId)
                .totalResources(allocations.size())
                .totalCapacity(totalCapacity)
                .totalAllocated(totalAllocated)
                .spareCapacity(spare)
                .utilizationRate(utilization)
                .highUtilizationResources(highUtilization)
                .highUtilizationShare(allocations.isEmpty() ? 0.0 : (double) highUtilization.size() / allocations.size())
                .riskCount(risks.size());

        if (risks.isEmpty()) {
            log.warn("No resource risks found for project {}", projectId);
            ResourceRiskAnalysis result = builder
                    .expectedExtraDemand(0.0)
                    .conflictProbability(0.0)
                    .probabilityWithinCapacity(1.0)
                    .topRiskContributors(List.of())
                    .recommendations(List.of("Insufficient resource data for analysis"))
                    .note("No resource risks identified for analysis")
                    .build();
            finish(projectId, RESOURCES, null, 0, Map.of("probabilityWithinCapacity", 1.0));
            return result;
        }

        SimulationResults results = engine.runSimulation(risks, iterations, seed);
        double[] extraDemand = new double[results.getIterationCount()];
        for (RiskTrace trace : results.getRiskTraces()) {
            double[] impacts = trace.impacts();
            for (int i = 0; i < extraDemand.length; i++) {
                extraDemand[i] += impacts[i];
            }
        }
        double conflict = fraction(extraDemand, demand -> demand > spare);

        ResourceRiskAnalysis result = builder
                .expectedExtraDemand(mean(extraDemand))
                .conflictProbability(conflict)
                .probabilityWithinCapacity(1.0 - conflict)
                .topRiskContributors(analyzer.identifyTopRiskContributors(results))
                .recommendations(resourceRecommendations(utilization, conflict, highUtilization))
                .simulationId(results.getSimulationId())
                .build();
        metricsService.recordSimulation(results.getExecutionTime());
        finish(projectId, RESOURCES, results.getSimulationId(), risks.size(),
                Map.of("conflictProbability", conflict, "iterations", iterations));
        return result;
    }

    List<String> resourceRecommendations(double utilization, double conflict, List<HighUtilizationResource> highUtilization) {
        ProjectAnalysisProperties.Resources thresholds = analysisProperties.getResources();
        List<String> recommendations = new ArrayList<>();
        if (utilization > thresholds.getUtilizationWarningThreshold()) {
            recommendations.add(String.format(Locale.ROOT,
                    "High resource utilization detected (>%.0f%%). Consider adding buffer capacity or adjusting timeline.",
                    thresholds.getUtilizationWarningThreshold() * 100.0));
        }
        if (conflict > thresholds.getConflictWarningThreshold()) {
            recommendations.add(String.format(Locale.ROOT,
                    "Resource conflict risk is elevated (%.1f%%). Review resource allocation for %d high-risk resources.",
                    conflict * 100.0, highUtilization.size()));
        }
        if (!highUtilization.isEmpty()) {
            List<String> names = highUtilization.stream().limit(3).map(HighUtilizationResource::resourceName).toList();
            recommendations.add("Critical resources requiring attention: " + String.join(", ", names));
        }
        if (recommendations.isEmpty()) {
            recommendations.add("Resource allocation appears balanced. Continue monitoring utilization trends.");
        }
        return recommendations;
    }

    AnalysisSummary summarize(BudgetVarianceAnalysis budget, ScheduleVarianceAnalysis schedule,
                              ResourceRiskAnalysis resources) {
        ProjectAnalysisProperties.Budget budgetThresholds = analysisProperties.getBudget();
        ProjectAnalysisProperties.Schedule scheduleThresholds = analysisProperties.getSchedule();
        ProjectAnalysisProperties.Resources resourceThresholds = analysisProperties.getResources();

        RiskLevel budgetLevel = levelFromProbability(budget.getProbabilityWithinBudget(),
                budgetThresholds.getHighRiskThreshold(), budgetThresholds.getMediumRiskThreshold());
        RiskLevel scheduleLevel = levelFromProbability(schedule.getProbabilityOnTime(),
                scheduleThresholds.getHighRiskThreshold(), scheduleThresholds.getMediumRiskThreshold());
        double conflict = resources.getConflictProbability();
        RiskLevel resourceLevel = conflict < resourceThresholds.getMediumConflictThreshold()
                ? RiskLevel.LOW
                : conflict < resourceThresholds.getHighConflictThreshold() ? RiskLevel.MEDIUM : RiskLevel.HIGH;

        List<String> insights = new ArrayList<>();
        double varianceThreshold = budgetThresholds.getVarianceInsightPct();
        if (budget.getVariancePercentage() > varianceThreshold) {
            insights.add(String.format(Locale.ROOT, "Budget variance of %.1f%% exceeds threshold",
                    budget.getVariancePercentage()));
        }
        if (schedule.getVariancePercentage() > varianceThreshold) {
            insights.add(String.format(Locale.ROOT, "Schedule variance of %.1f%% exceeds threshold",
                    schedule.getVariancePercentage()));
        }
        if (conflict > resourceThresholds.getConflictInsightThreshold()) {
            insights.add("High probability of resource conflicts detected");
        }

        RiskLevel overall = budgetLevel;
        if (scheduleLevel.compareTo(overall) > 0) {
            overall = scheduleLevel;
        }
        if (resourceLevel.compareTo(overall) > 0) {
            overall = resourceLevel;
        }
        return AnalysisSummary.builder()
                .overallRiskLevel(overall)
                .budgetRiskLevel(budgetLevel)
                .scheduleRiskLevel(scheduleLevel)
                .resourceRiskLevel(resourceLevel)
                .keyInsights(insights)
                .probabilityOfSuccess(Math.min(budget.getProbabilityWithinBudget(), schedule.getProbabilityOnTime()))
                .build();
    }

    private CriticalPathAnalysis criticalPath(List<MilestoneRecord> milestones, double meanDelay, double baselineDuration) {
        List<MilestoneRecord> critical = milestones.stream().filter(MilestoneRecord::criticalPath).toList();
        if (critical.isEmpty()) {
            return CriticalPathAnalysis.builder()
                    .criticalPathIdentified(false)
                    .criticalMilestones(0)
                    .openCriticalMilestones(0)
                    .delayRisk(0.0)
                    .milestoneDetails(List.of())
                    .build();
        }
        return CriticalPathAnalysis.builder()
                .criticalPathIdentified(true)
                .criticalMilestones(critical.size())
                .openCriticalMilestones((int) critical.stream().filter(milestone -> !milestone.completed()).count())
                .delayRisk(baselineDuration > 0 ? Math.max(0.0, meanDelay / baselineDuration) : 0.0)
                .milestoneDetails(critical.stream()
                        .map(milestone -> new CriticalPathAnalysis.MilestoneDetail(milestone.id(), milestone.name(),
                                milestone.plannedDate(), milestone.baselineDurationDays(), milestone.completed()))
                        .toList())
                .build();
    }

    private void validateRequest(Long projectId, int iterations, double confidenceLevel) {
        if (projectId == null) {
            throw new SimulationPreconditionException("Project id is required");
        }
        if (iterations < simulationProperties.getMinIterations()) {
            throw new SimulationPreconditionException("Iterations must be at least "
                    + simulationProperties.getMinIterations() + ", got " + iterations);
        }
        if (iterations > simulationProperties.getMaxIterations()) {
            throw new SimulationPreconditionException("Iterations must not exceed "
                    + simulationProperties.getMaxIterations() + ", got " + iterations);
        }
        ResultsAnalyzer.requireConfidenceLevel(confidenceLevel);
    }

    private ProjectBaseline loadBaseline(Long projectId) {
        return projectDataPort.findBaseline(projectId)
                .orElseThrow(() -> new ProjectNotFoundException(projectId));
    }

    private void finish(Long projectId, String dimension, String simulationId, int riskCount, Map<String, Object> details) {
        String outcome = simulationId == null
                ? SimulationMetricsService.OUTCOME_DEGENERATE
                : SimulationMetricsService.OUTCOME_SIMULATED;
        metricsService.recordAnalysis(dimension, outcome);
        Map<String, Object> metadata = new LinkedHashMap<>(details);
        metadata.put("riskCount", riskCount);
        auditEventService.recordAnalysis(projectId, dimension.toUpperCase(Locale.ROOT) + "_ANALYSIS", simulationId,
                "Monte Carlo " + dimension + " analysis (" + outcome + ")", metadata);
        log.info("Finished {} analysis for project {} ({} risks, {})", dimension, projectId, riskCount, outcome);
    }

    private Interval interval(OutcomeType outcomeType, double[] outcomes, double confidenceLevel) {
        return analyzer.intervals(outcomeType, outcomes, List.of(confidenceLevel)).intervals().get(0);
    }

    private RiskRecordTranslator translator() {
        return new RiskRecordTranslator(analysisProperties.getDistribution());
    }

    private static RiskLevel levelFromProbability(double probability, double lowRiskAbove, double mediumRiskAbove) {
        if (probability > lowRiskAbove) {
            return RiskLevel.LOW;
        }
        return probability > mediumRiskAbove ? RiskLevel.MEDIUM : RiskLevel.HIGH;
    }

    private static double[] shift(double[] values, double offset) {
        double[] shifted = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            shifted[i] = values[i] + offset;
        }
        return shifted;
    }

    private static double mean(double[] values) {
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return values.length == 0 ? 0.0 : sum / values.length;
    }

    private static double fraction(double[] values, DoublePredicate predicate) {
        if (values.length == 0) {
            return 0.0;
        }
        int hits = 0;
        for (double value : values) {
            if (predicate.test(value)) {
                hits++;
            }
        }
        return (double) hits / values.length;
    }

    private static double percentOf(double value, double base) {
        return base > 0 ? value / base * 100.0 : 0.0;
    }
}
