package com.ppm.backend.simulation.scenario;

import com.ppm.backend.exception.SimulationPreconditionException;
import com.ppm.backend.simulation.DistributionType;
import com.ppm.backend.simulation.MitigationStrategy;
import com.ppm.backend.simulation.ProbabilityDistribution;
import com.ppm.backend.simulation.Risk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Builds what-if risk sets. Base risks are immutable, so untouched risks are shared and
 * modified ones are rebuilt through {@code toBuilder()}.
 */
@Slf4j
@Service
public class ScenarioGenerator {

    public Scenario createScenario(List<Risk> baseRisks,
                                   Map<String, RiskModification> modifications,
                                   String name,
                                   String description) {
        if (baseRisks == null) {
            throw new SimulationPreconditionException("Base risks are required");
        }
        if (name == null || name.isBlank()) {
            throw new SimulationPreconditionException("Scenario name is required");
        }
        Map<String, RiskModification> changes = modifications == null ? Map.of() : modifications;
        Set<String> ids = new HashSet<>();
        for (Risk risk : baseRisks) {
            ids.add(risk.id());
        }
        for (String riskId : changes.keySet()) {
            if (!ids.contains(riskId)) {
                throw new SimulationPreconditionException("Modification references non-existent risk: " + riskId);
            }
        }

        List<Risk> risks = new ArrayList<>(baseRisks.size());
        Set<String> mitigated = new LinkedHashSet<>();
        for (Risk risk : baseRisks) {
            RiskModification modification = changes.get(risk.id());
            if (modification == null) {
                risks.add(risk);
                continue;
            }
            risks.add(apply(risk, modification));
            if (modification.mitigationApplied()) {
                mitigated.add(risk.id());
            }
        }
        log.debug("Created scenario '{}' with {} modified risks", name, changes.size());
        return new Scenario(UUID.randomUUID().toString(), name, description == null ? "" : description,
                risks, new LinkedHashMap<>(changes), mitigated, Instant.now());
    }

    public Scenario createBaselineScenario(List<Risk> risks, String name) {
        return createScenario(risks, Map.of(), name == null ? "Baseline" : name,
                "Baseline scenario with original risk parameters");
    }

    /**
     * Same scenario with one risk's impact distribution scaled by {@code factor}.
     */
    public Scenario createScaledScenario(Scenario base, String riskId, double factor, String name) {
        Risk target = requireRisk(base, riskId);
        List<Risk> risks = new ArrayList<>(base.risks().size());
        for (Risk risk : base.risks()) {
            if (risk == target) {
                risks.add(risk.toBuilder()
                        .distribution(risk.distribution().scaled(factor))
                        .baselineImpact(risk.baselineImpact() * factor)
                        .build());
            } else {
                risks.add(risk);
            }
        }
        return new Scenario(UUID.randomUUID().toString(), name,
                "Scenario with " + riskId + " impact scaled by " + factor,
                risks, base.modifications(), base.mitigatedRiskIds(), Instant.now());
    }

    /**
     * Applies one mitigation per listed risk on top of {@code base}.
     */
    public Scenario createMitigatedScenario(Scenario base, Map<String, String> mitigationPlan,
                                            String name, String description) {
        Map<String, RiskModification> modifications = new LinkedHashMap<>();
        mitigationPlan.forEach((riskId, strategyId) -> modifications.put(riskId, RiskModification.mitigation(strategyId)));
        return createScenario(base.risks(), modifications, name, description);
    }

    public MitigationAnalysis evaluateMitigationStrategy(Scenario scenario, MitigationStrategy mitigation, String riskId) {
        Risk target = requireRisk(scenario, riskId);
        if (mitigation == null || target.findMitigation(mitigation.id()).isEmpty()) {
            throw new SimulationPreconditionException("Mitigation "
                    + (mitigation == null ? null : mitigation.id()) + " not applicable to risk " + riskId);
        }
        double baseline = target.baselineImpact();
        double mitigatedRisk = baseline * (1.0 - mitigation.effectiveness());
        double reduction = baseline - mitigatedRisk;
        return MitigationAnalysis.builder()
                .strategyId(mitigation.id())
                .riskId(riskId)
                .cost(mitigation.cost())
                .baselineRisk(baseline)
                .mitigatedRisk(mitigatedRisk)
                .riskReduction(reduction)
                .costBenefitRatio(reduction > 0 ? mitigation.cost() / reduction : null)
                .netPresentValue(reduction - mitigation.cost())
                .returnOnInvestment(mitigation.cost() > 0 ? (reduction - mitigation.cost()) / mitigation.cost() : null)
                .build();
    }

    /**
     * Every strategy of the risk, best net present value first.
     */
    public List<MitigationAnalysis> compareMitigationStrategies(Scenario scenario, String riskId) {
        Risk target = requireRisk(scenario, riskId);
        return target.mitigationStrategies().stream()
                .map(strategy -> evaluateMitigationStrategy(scenario, strategy, riskId))
                .sorted(Comparator.comparingDouble(MitigationAnalysis::netPresentValue).reversed()
                        .thenComparing(MitigationAnalysis::strategyId))
                .toList();
    }

    public double expectedValueOfMitigation(Scenario scenario, MitigationStrategy mitigation,
                                            String riskId, double riskProbability) {
        if (!(riskProbability >= 0.0 && riskProbability <= 1.0)) {
            throw new SimulationPreconditionException("Risk probability must be within [0, 1], got " + riskProbability);
        }
        MitigationAnalysis analysis = evaluateMitigationStrategy(scenario, mitigation, riskId);
        return riskProbability * analysis.riskReduction() - mitigation.cost();
    }

    private Risk apply(Risk risk, RiskModification modification) {
        ProbabilityDistribution distribution = risk.distribution();
        DistributionType type = modification.distributionType();
        if (type != null && type != distribution.getType()) {
            distribution = distribution.withType(type, modification.parameterChanges());
        } else {
            distribution = distribution.withParameters(modification.parameterChanges());
        }

        double baselineImpact = risk.baselineImpact();
        if (modification.mitigationStrategyId() != null) {
            MitigationStrategy strategy = risk.findMitigation(modification.mitigationStrategyId())
                    .orElseThrow(() -> new SimulationPreconditionException("Mitigation "
                            + modification.mitigationStrategyId() + " not applicable to risk " + risk.id()));
            double remaining = 1.0 - strategy.effectiveness();
            baselineImpact *= remaining;
            distribution = remaining > 0
                    ? distribution.scaled(remaining)
                    : new ProbabilityDistribution(DistributionType.UNIFORM, Map.of("min", 0.0, "max", 0.0),
                    distribution.getBounds());
        }

        return risk.toBuilder()
                .distribution(distribution)
                .baselineImpact(baselineImpact)
                .mitigationApplied(risk.mitigationApplied() || modification.mitigationApplied())
                .build();
    }

    private static Risk requireRisk(Scenario scenario, String riskId) {
        if (scenario == null) {
            throw new SimulationPreconditionException("Scenario is required");
        }
        return scenario.findRisk(riskId)
                .orElseThrow(() -> new SimulationPreconditionException("Risk " + riskId + " not found in scenario"));
    }
}
