package com.ppm.backend.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class SimulationMetricsServiceTest {

    @Test
    void countsAnalysesPerDimensionAndOutcome() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        SimulationMetricsService metrics = new SimulationMetricsService(registry);
        metrics.init();

        metrics.recordAnalysis("budget", SimulationMetricsService.OUTCOME_SIMULATED);
        metrics.recordAnalysis("budget", SimulationMetricsService.OUTCOME_SIMULATED);
        metrics.recordAnalysis("resources", SimulationMetricsService.OUTCOME_DEGENERATE);

        assertThat(registry.get("risk_analyses_total").tag("dimension", "budget").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("risk_analyses_total").tag("outcome", "degenerate").counter().count()).isEqualTo(1.0);
    }

    @Test
    void recordsSimulationTime() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        SimulationMetricsService metrics = new SimulationMetricsService(registry);
        metrics.init();

        metrics.recordSimulation(Duration.ofMillis(250));
        metrics.recordSimulation(null);

        assertThat(registry.get("risk_simulation_seconds").timer().count()).isEqualTo(1L);
        assertThat(registry.get("risk_simulation_seconds").timer().totalTime(TimeUnit.MILLISECONDS)).isEqualTo(250.0);
    }
}
