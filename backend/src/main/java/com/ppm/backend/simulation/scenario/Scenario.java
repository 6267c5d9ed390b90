package com.ppm.backend.simulation.scenario;

import com.ppm.backend.simulation.Risk;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public record Scenario(String id,
                       String name,
                       String description,
                       List<Risk> risks,
                       Map<String, RiskModification> modifications,
                       Set<String> mitigatedRiskIds,
                       Instant createdAt) {

    public Scenario {
        risks = List.copyOf(risks);
        modifications = modifications == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(modifications));
        mitigatedRiskIds = mitigatedRiskIds == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(mitigatedRiskIds));
    }

    public Optional<Risk> findRisk(String riskId) {
        return risks.stream().filter(risk -> risk.id().equals(riskId)).findFirst();
    }
}
