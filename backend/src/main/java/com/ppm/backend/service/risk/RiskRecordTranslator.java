package com.ppm.backend.service.risk;

import com.ppm.backend.config.ProjectAnalysisProperties;
import com.ppm.backend.exception.ConstructionValidationException;
import com.ppm.backend.simulation.ImpactType;
import com.ppm.backend.simulation.ProbabilityDistribution;
import com.ppm.backend.simulation.Risk;
import com.ppm.backend.simulation.RiskCategory;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns stored risk records into simulation inputs. Deterministic, no state beyond its two ratios.
 * Budget risks are sized by the cost estimate, schedule risks by the schedule estimate in days.
 * Records with an unknown impact type, or without an estimate for the dimension, are skipped.
 * <ul>
 *   <li>triangular (also the default): min = low or 0, mode = most likely or baseline,
 *   max = high or mode times the max factor</li>
 *   <li>normal: mean = mean or baseline impact, std = std or |mean| times the std ratio</li>
 *   <li>anything else: triangular over half, one and one and a half times the baseline impact</li>
 * </ul>
 * Records that cannot form a valid distribution are skipped.
 */
@Slf4j
public final class RiskRecordTranslator {

    private final double normalStdRatio;
    private final double triangularMaxFactor;

    public RiskRecordTranslator(ProjectAnalysisProperties.Distribution settings) {
        this(settings.getNormalStdRatio(), settings.getTriangularMaxFactor());
    }

    public RiskRecordTranslator(double normalStdRatio, double triangularMaxFactor) {
        this.normalStdRatio = normalStdRatio;
        this.triangularMaxFactor = triangularMaxFactor;
    }

    public List<Risk> budgetRisks(List<ProjectDataPort.RiskRecord> records) {
        return dimensionRisks(records, ImpactType.COST);
    }

    public List<Risk> scheduleRisks(List<ProjectDataPort.RiskRecord> records) {
        return dimensionRisks(records, ImpactType.SCHEDULE);
    }

    /**
     * Resource-category records sized by their resource estimate in hours. The impact type is kept
     * for reporting, unknown values read as both.
     */
    public List<Risk> resourceRisks(List<ProjectDataPort.RiskRecord> records) {
        List<Risk> risks = new ArrayList<>();
        for (ProjectDataPort.RiskRecord record : records) {
            if (RiskCategory.fromString(record.category()) != RiskCategory.RESOURCE) {
                continue;
            }
            if (isMissing(record.resource())) {
                log.warn("Skipping risk record {}: no resource estimate", record.id());
                continue;
            }
            translate(record, record.resource(), ImpactType.fromString(record.impactType()))
                    .ifPresent(risks::add);
        }
        return risks;
    }

    private List<Risk> dimensionRisks(List<ProjectDataPort.RiskRecord> records, ImpactType dimension) {
        List<Risk> risks = new ArrayList<>();
        for (ProjectDataPort.RiskRecord record : records) {
            Optional<ImpactType> declared = ImpactType.find(record.impactType());
            if (declared.isEmpty()) {
                log.warn("Skipping risk record {}: unknown impact type '{}'", record.id(), record.impactType());
                continue;
            }
            boolean applies = dimension == ImpactType.COST
                    ? declared.get().affectsCost()
                    : declared.get().affectsSchedule();
            if (!applies) {
                continue;
            }
            ProjectDataPort.ImpactEstimate estimate = dimension == ImpactType.COST ? record.cost() : record.schedule();
            if (isMissing(estimate)) {
                log.warn("Skipping risk record {}: no {} estimate", record.id(),
                        dimension.name().toLowerCase(Locale.ROOT));
                continue;
            }
            translate(record, estimate, dimension).ifPresent(risks::add);
        }
        return risks;
    }

    public Optional<Risk> translate(ProjectDataPort.RiskRecord record,
                                    ProjectDataPort.ImpactEstimate estimate,
                                    ImpactType impactType) {
        try {
            ProbabilityDistribution distribution = distributionFor(record.distributionType(), estimate);
            double baselineImpact = estimate.baseline() != null
                    ? estimate.baseline()
                    : distribution.mean();
            return Optional.of(Risk.builder()
                    .id(record.id())
                    .name(record.title() == null || record.title().isBlank() ? "Unnamed Risk" : record.title())
                    .category(RiskCategory.fromString(record.category()))
                    .impactType(impactType)
                    .distribution(distribution)
                    .baselineImpact(baselineImpact)
                    .build());
        } catch (ConstructionValidationException e) {
            log.warn("Skipping risk record {}: {}", record.id(), e.getMessage());
            return Optional.empty();
        }
    }

    public ProbabilityDistribution distributionFor(String distributionType, ProjectDataPort.ImpactEstimate estimate) {
        String declared = distributionType == null || distributionType.isBlank()
                ? "triangular"
                : distributionType.trim().toLowerCase(Locale.ROOT);
        double baseline = orZero(estimate.baseline());
        switch (declared) {
            case "triangular" -> {
                double min = orZero(estimate.low());
                double mode = estimate.mostLikely() != null ? estimate.mostLikely() : baseline;
                double max = estimate.high() != null ? estimate.high() : mode * triangularMaxFactor;
                return ProbabilityDistribution.triangular(min, mode, max);
            }
            case "normal" -> {
                double mean = estimate.mean() != null ? estimate.mean() : baseline;
                double std = estimate.std() != null ? estimate.std() : Math.abs(mean) * normalStdRatio;
                return ProbabilityDistribution.normal(mean, std);
            }
            default -> {
                return ProbabilityDistribution.triangular(baseline * 0.5, baseline, baseline * 1.5);
            }
        }
    }

    private static boolean isMissing(ProjectDataPort.ImpactEstimate estimate) {
        return estimate == null || estimate.isEmpty();
    }

    private static double orZero(Double value) {
        return value == null ? 0.0 : value;
    }
}
