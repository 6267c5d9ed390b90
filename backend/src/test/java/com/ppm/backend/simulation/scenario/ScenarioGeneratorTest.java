package com.ppm.backend.simulation.scenario;

import com.ppm.backend.exception.ConstructionValidationException;
import com.ppm.backend.exception.SimulationPreconditionException;
import com.ppm.backend.simulation.DistributionType;
import com.ppm.backend.simulation.ImpactType;
import com.ppm.backend.simulation.MitigationStrategy;
import com.ppm.backend.simulation.ProbabilityDistribution;
import com.ppm.backend.simulation.Risk;
import com.ppm.backend.simulation.RiskCategory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ScenarioGeneratorTest {

    private final ScenarioGenerator generator = new ScenarioGenerator();

    private final MitigationStrategy extraVendor = MitigationStrategy.builder()
            .id("M1")
            .name("Second vendor")
            .cost(5_000.0)
            .effectiveness(0.4)
            .implementationDays(10)
            .build();

    private final MitigationStrategy insurance = MitigationStrategy.builder()
            .id("M2")
            .name("Insurance")
            .cost(30_000.0)
            .effectiveness(1.0)
            .build();

    private final Risk vendorRisk = Risk.builder()
            .id("R1")
            .name("Vendor slip")
            .category(RiskCategory.EXTERNAL)
            .impactType(ImpactType.COST)
            .distribution(ProbabilityDistribution.triangular(10_000.0, 20_000.0, 40_000.0))
            .baselineImpact(20_000.0)
            .mitigationStrategies(List.of(extraVendor, insurance))
            .build();

    private final Risk staffRisk = Risk.builder()
            .id("R2")
            .name("Key staff leaves")
            .impactType(ImpactType.SCHEDULE)
            .distribution(ProbabilityDistribution.normal(15.0, 5.0))
            .baselineImpact(15.0)
            .build();

    @Test
    void modificationLeavesBaseRisksUntouched() {
        List<Risk> base = List.of(vendorRisk, staffRisk);

        Scenario scenario = generator.createScenario(base,
                Map.of("R1", RiskModification.parameters(Map.of("max", 60_000.0))), "Pessimistic", null);

        assertThat(vendorRisk.distribution().parameter("max")).isEqualTo(40_000.0);
        assertThat(scenario.findRisk("R1").orElseThrow().distribution().parameter("max")).isEqualTo(60_000.0);
        assertThat(scenario.findRisk("R1").orElseThrow().distribution().parameter("mode")).isEqualTo(20_000.0);
        assertThat(scenario.findRisk("R2").orElseThrow()).isSameAs(staffRisk);
        assertThat(scenario.mitigatedRiskIds()).isEmpty();
        assertThat(scenario.description()).isEmpty();
    }

    @Test
    void unknownTargetIsRejected() {
        assertThatThrownBy(() -> generator.createScenario(List.of(vendorRisk),
                Map.of("R9", RiskModification.parameters(Map.of("max", 1.0))), "Broken", null))
                .isInstanceOf(SimulationPreconditionException.class)
                .hasMessageContaining("R9");
    }

    @Test
    void blankNameIsRejected() {
        assertThatThrownBy(() -> generator.createScenario(List.of(vendorRisk), Map.of(), " ", null))
                .isInstanceOf(SimulationPreconditionException.class);
    }

    @Test
    void invalidMergedParametersFail() {
        assertThatThrownBy(() -> generator.createScenario(List.of(vendorRisk),
                Map.of("R1", RiskModification.parameters(Map.of("mode", 90_000.0))), "Broken", null))
                .isInstanceOf(ConstructionValidationException.class)
                .hasMessageContaining("'mode'");
    }

    @Test
    void switchesDistributionFamily() {
        RiskModification toUniform = RiskModification.builder()
                .distributionType(DistributionType.UNIFORM)
                .parameterChanges(Map.of("max", 50_000.0))
                .build();

        Scenario scenario = generator.createScenario(List.of(vendorRisk), Map.of("R1", toUniform), "Flat", "flat");

        ProbabilityDistribution distribution = scenario.findRisk("R1").orElseThrow().distribution();
        assertThat(distribution.getType()).isEqualTo(DistributionType.UNIFORM);
        assertThat(distribution.getParameters()).containsEntry("min", 10_000.0).containsEntry("max", 50_000.0);
    }

    @Test
    void mitigationScalesImpactByRemainingShare() {
        Scenario baseline = generator.createBaselineScenario(List.of(vendorRisk, staffRisk), null);

        Scenario mitigated = generator.createMitigatedScenario(baseline, Map.of("R1", "M1"), "Mitigated", null);

        Risk risk = mitigated.findRisk("R1").orElseThrow();
        assertThat(risk.mitigationApplied()).isTrue();
        assertThat(risk.baselineImpact()).isCloseTo(12_000.0, within(1e-9));
        assertThat(risk.distribution().mean()).isCloseTo(vendorRisk.distribution().mean() * 0.6, within(1e-6));
        assertThat(mitigated.mitigatedRiskIds()).containsExactly("R1");
        assertThat(baseline.name()).isEqualTo("Baseline");
    }

    @Test
    void fullyEffectiveMitigationRemovesImpact() {
        Scenario scenario = generator.createScenario(List.of(vendorRisk),
                Map.of("R1", RiskModification.mitigation("M2")), "Insured", null);

        Risk risk = scenario.findRisk("R1").orElseThrow();
        assertThat(risk.baselineImpact()).isZero();
        assertThat(risk.distribution().mean()).isZero();
    }

    @Test
    void unknownMitigationIsRejected() {
        assertThatThrownBy(() -> generator.createScenario(List.of(staffRisk),
                Map.of("R2", RiskModification.mitigation("M1")), "Wrong", null))
                .isInstanceOf(SimulationPreconditionException.class)
                .hasMessageContaining("M1");
    }

    @Test
    void scaledScenarioOnlyTouchesTarget() {
        Scenario baseline = generator.createBaselineScenario(List.of(vendorRisk, staffRisk), "Base");

        Scenario scaled = generator.createScaledScenario(baseline, "R2", 1.2, "R2_high");

        assertThat(scaled.findRisk("R2").orElseThrow().distribution().parameter("mean")).isCloseTo(18.0, within(1e-9));
        assertThat(scaled.findRisk("R2").orElseThrow().baselineImpact()).isCloseTo(18.0, within(1e-9));
        assertThat(scaled.findRisk("R1").orElseThrow()).isSameAs(vendorRisk);
    }

    @Test
    void evaluatesMitigationEconomics() {
        Scenario scenario = generator.createBaselineScenario(List.of(vendorRisk), null);

        MitigationAnalysis analysis = generator.evaluateMitigationStrategy(scenario, extraVendor, "R1");

        assertThat(analysis.riskReduction()).isCloseTo(8_000.0, within(1e-9));
        assertThat(analysis.mitigatedRisk()).isCloseTo(12_000.0, within(1e-9));
        assertThat(analysis.netPresentValue()).isCloseTo(3_000.0, within(1e-9));
        assertThat(analysis.costBenefitRatio()).isCloseTo(0.625, within(1e-9));
        assertThat(analysis.returnOnInvestment()).isCloseTo(0.6, within(1e-9));
    }

    @Test
    void comparesStrategiesByNetPresentValue() {
        Scenario scenario = generator.createBaselineScenario(List.of(vendorRisk), null);

        List<MitigationAnalysis> ranked = generator.compareMitigationStrategies(scenario, "R1");

        assertThat(ranked).extracting(MitigationAnalysis::strategyId).containsExactly("M1", "M2");
        assertThat(ranked.get(1).netPresentValue()).isCloseTo(-10_000.0, within(1e-9));
    }

    @Test
    void expectedValueWeightsReductionByProbability() {
        Scenario scenario = generator.createBaselineScenario(List.of(vendorRisk), null);

        assertThat(generator.expectedValueOfMitigation(scenario, extraVendor, "R1", 0.5))
                .isCloseTo(-1_000.0, within(1e-9));
        assertThatThrownBy(() -> generator.expectedValueOfMitigation(scenario, extraVendor, "R1", 1.5))
                .isInstanceOf(SimulationPreconditionException.class);
    }
}
