package com.ppm.backend.simulation;

import com.ppm.backend.exception.SimulationPreconditionException;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.springframework.stereotype.Component;

@Component
public class DistributionSampler {

    public RandomGenerator newGenerator(Long seed) {
        return seed == null ? new Well19937c() : new Well19937c(seed);
    }

    public double[] sample(ProbabilityDistribution distribution, int count, RandomGenerator rng) {
        if (distribution == null) {
            throw new SimulationPreconditionException("Distribution is required");
        }
        if (count < 0) {
            throw new SimulationPreconditionException("Sample count must be >= 0, got " + count);
        }
        double[] draws = new double[count];
        for (int i = 0; i < count; i++) {
            draws[i] = distribution.sample(rng);
        }
        return draws;
    }

    /**
     * Maps already drawn standard-normal latents through the distribution, in place order.
     */
    public double[] fromLatents(ProbabilityDistribution distribution, double[] latents) {
        double[] draws = new double[latents.length];
        for (int i = 0; i < latents.length; i++) {
            draws[i] = distribution.fromStandardNormal(latents[i]);
        }
        return draws;
    }
}
