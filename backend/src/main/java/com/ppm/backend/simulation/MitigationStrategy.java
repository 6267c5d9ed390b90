package com.ppm.backend.simulation;

import com.ppm.backend.exception.ConstructionValidationException;
import lombok.Builder;

@Builder
public record MitigationStrategy(String id,
                                 String name,
                                 String description,
                                 double cost,
                                 double effectiveness,
                                 int implementationDays) {

    public MitigationStrategy {
        if (id == null || id.isBlank()) {
            throw new ConstructionValidationException("Mitigation id is required");
        }
        if (name == null || name.isBlank()) {
            throw new ConstructionValidationException("Mitigation '" + id + "' requires a name");
        }
        if (!Double.isFinite(cost) || cost < 0) {
            throw new ConstructionValidationException("Mitigation '" + id + "' cost must be >= 0, got " + cost);
        }
        if (!(effectiveness >= 0.0 && effectiveness <= 1.0)) {
            throw new ConstructionValidationException(
                    "Mitigation '" + id + "' effectiveness must be within [0, 1], got " + effectiveness);
        }
        if (implementationDays < 0) {
            throw new ConstructionValidationException(
                    "Mitigation '" + id + "' implementation days must be >= 0, got " + implementationDays);
        }
    }
}
