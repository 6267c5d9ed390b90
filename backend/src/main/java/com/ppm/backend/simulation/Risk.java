package com.ppm.backend.simulation;

import com.ppm.backend.exception.ConstructionValidationException;
import lombok.Builder;

import java.util.List;
import java.util.Optional;

/**
 * A named uncertain factor. Immutable; modified risks are new instances built through {@link #toBuilder()}.
 */
@Builder(toBuilder = true)
public record Risk(String id,
                   String name,
                   RiskCategory category,
                   ImpactType impactType,
                   ProbabilityDistribution distribution,
                   double baselineImpact,
                   List<String> correlationDependencies,
                   List<MitigationStrategy> mitigationStrategies,
                   boolean mitigationApplied) {

    public Risk {
        if (id == null || id.isBlank()) {
            throw new ConstructionValidationException("Risk id is required");
        }
        if (name == null || name.isBlank()) {
            throw new ConstructionValidationException("Risk '" + id + "' requires a name");
        }
        if (distribution == null) {
            throw new ConstructionValidationException("Risk '" + id + "' requires a probability distribution");
        }
        if (!Double.isFinite(baselineImpact)) {
            throw new ConstructionValidationException("Risk '" + id + "' baseline impact must be finite");
        }
        category = category == null ? RiskCategory.OTHER : category;
        impactType = impactType == null ? ImpactType.BOTH : impactType;
        correlationDependencies = correlationDependencies == null ? List.of() : List.copyOf(correlationDependencies);
        mitigationStrategies = mitigationStrategies == null ? List.of() : List.copyOf(mitigationStrategies);
    }

    public Optional<MitigationStrategy> findMitigation(String mitigationId) {
        return mitigationStrategies.stream()
                .filter(strategy -> strategy.id().equals(mitigationId))
                .findFirst();
    }
}
