package com.ppm.backend.simulation.scenario;

import com.ppm.backend.simulation.DistributionType;
import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Targeted override of one risk. {@code parameterChanges} is merged into the existing parameters;
 * {@code mitigationStrategyId}, when set, applies that strategy's effectiveness to the risk.
 */
@Builder
public record RiskModification(Map<String, Double> parameterChanges,
                               boolean mitigationApplied,
                               DistributionType distributionType,
                               String mitigationStrategyId) {

    public RiskModification {
        parameterChanges = parameterChanges == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameterChanges));
        mitigationApplied = mitigationApplied || mitigationStrategyId != null;
    }

    public static RiskModification parameters(Map<String, Double> changes) {
        return new RiskModification(changes, false, null, null);
    }

    public static RiskModification mitigation(String mitigationStrategyId) {
        return new RiskModification(Map.of(), true, null, mitigationStrategyId);
    }
}
