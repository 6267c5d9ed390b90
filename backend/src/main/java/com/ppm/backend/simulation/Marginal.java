package com.ppm.backend.simulation;

import org.apache.commons.math3.special.Erf;

/**
 * Marginal shape of a single risk impact, addressed through its quantile function.
 */
interface Marginal {

    double SQRT2 = Math.sqrt(2.0);

    double quantile(double p);

    double mean();

    /**
     * Maps a standard-normal latent to a draw: {@code Q(Phi(z))} unless the family has a closed form.
     */
    default double fromStandardNormal(double z) {
        return quantile(standardNormalCdf(z));
    }

    static double standardNormalCdf(double z) {
        double p = 0.5 * Erf.erfc(-z / SQRT2);
        return Math.min(1.0, Math.max(0.0, p));
    }
}
