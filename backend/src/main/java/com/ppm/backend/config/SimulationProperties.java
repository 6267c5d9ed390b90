package com.ppm.backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "simulation")
@Data
@Validated
public class SimulationProperties {

    @Min(1)
    private int minIterations = 10_000;

    @Positive
    private int maxIterations = 1_000_000;

    @Positive
    private int defaultIterations = 10_000;

    @NotEmpty
    private List<Double> percentiles = new ArrayList<>(List.of(5.0, 10.0, 25.0, 50.0, 75.0, 80.0, 90.0, 95.0, 99.0));

    @NotEmpty
    private List<Double> confidenceLevels = new ArrayList<>(List.of(0.80, 0.90, 0.95));

    @DecimalMin("0.0001")
    @DecimalMax("0.5")
    private double significanceLevel = 0.05;

    @Positive
    private int topContributors = 10;

    @Positive
    private int convergenceCheckpoint = 1_000;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double convergenceThreshold = 0.95;
}
