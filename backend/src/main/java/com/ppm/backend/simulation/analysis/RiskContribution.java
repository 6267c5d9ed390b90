package com.ppm.backend.simulation.analysis;

import com.ppm.backend.simulation.ImpactType;
import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Share of summed per-risk variance attributable to one risk, with its correlation to the totals.
 */
@Builder
public record RiskContribution(String riskId,
                               String riskName,
                               ImpactType impactType,
                               double meanImpact,
                               double stdDev,
                               double variance,
                               double minImpact,
                               double maxImpact,
                               double contributionPercentage,
                               double costCorrelation,
                               double scheduleCorrelation,
                               Map<String, Double> correlationEffects) {

    public RiskContribution {
        correlationEffects = correlationEffects == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(correlationEffects));
    }
}
