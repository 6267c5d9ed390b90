package com.ppm.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Service
@RequiredArgsConstructor
public class SimulationMetricsService {

    public static final String OUTCOME_SIMULATED = "simulated";
    public static final String OUTCOME_DEGENERATE = "degenerate";

    private final MeterRegistry meterRegistry;

    private Timer simulationTimer;

    @PostConstruct
    void init() {
        simulationTimer = Timer.builder("risk_simulation_seconds")
                .description("Wall-clock time of Monte Carlo runs")
                .register(meterRegistry);
    }

    public void recordAnalysis(String dimension, String outcome) {
        Counter.builder("risk_analyses_total")
                .tag("dimension", dimension == null ? "unknown" : dimension)
                .tag("outcome", outcome == null ? "unknown" : outcome)
                .register(meterRegistry)
                .increment();
    }

    public void recordSimulation(Duration executionTime) {
        if (simulationTimer != null && executionTime != null) {
            simulationTimer.record(executionTime);
        }
    }
}
