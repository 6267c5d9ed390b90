package com.ppm.backend.simulation;

import com.ppm.backend.exception.NumericalStabilityException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.NonSymmetricMatrixException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.RandomGenerator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Gaussian copula sampling: correlated standard-normal latents from a Cholesky factor,
 * each mapped through its own risk's marginal.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CorrelationInjector {

    static final double EIGENVALUE_FLOOR = 1e-8;
    private static final double SYMMETRY_THRESHOLD = 1e-10;
    private static final double POSITIVITY_THRESHOLD = 1e-10;

    private final DistributionSampler sampler;

    /**
     * Returns one row of {@code iterations} impacts per risk, in risk order.
     * Latents are drawn iteration by iteration, risk by risk, so a seeded generator always
     * yields the same arrays for the same input.
     */
    public CorrelatedSamples generate(List<Risk> risks, CorrelationMatrix matrix, int iterations, RandomGenerator rng) {
        int k = risks.size();
        double[][] latents = new double[k][iterations];
        for (int i = 0; i < iterations; i++) {
            for (int r = 0; r < k; r++) {
                latents[r][i] = rng.nextGaussian();
            }
        }

        boolean adjusted = false;
        if (matrix != null && !matrix.isEmpty()) {
            int[] participants = participantIndices(risks, matrix);
            List<String> order = new ArrayList<>(participants.length);
            for (int index : participants) {
                order.add(risks.get(index).id());
            }
            Factorization factorization = factor(matrix, order);
            adjusted = factorization.adjusted();
            correlate(latents, participants, factorization.lower());
        }

        double[][] samples = new double[k][];
        for (int r = 0; r < k; r++) {
            samples[r] = sampler.fromLatents(risks.get(r).distribution(), latents[r]);
        }
        return new CorrelatedSamples(samples, adjusted);
    }

    /**
     * Cholesky factor of the dense correlation matrix over {@code order}. A matrix that cannot be
     * factored is replaced by its nearest correlation matrix first.
     */
    public Factorization factor(CorrelationMatrix matrix, List<String> order) {
        double[][] dense = matrix.toDense(order);
        try {
            return new Factorization(cholesky(dense), dense, false);
        } catch (NonPositiveDefiniteMatrixException | NonSymmetricMatrixException e) {
            double[][] projected = nearestCorrelation(dense);
            log.warn("Correlation matrix over {} is not positive definite, using nearest correlation matrix", order);
            try {
                return new Factorization(cholesky(projected), projected, true);
            } catch (NonPositiveDefiniteMatrixException | NonSymmetricMatrixException retry) {
                throw new NumericalStabilityException(
                        "Correlation matrix over " + order + " cannot be embedded even after projection", retry);
            }
        }
    }

    /**
     * Eigenvalue clipping at {@value #EIGENVALUE_FLOOR}, then symmetrised and rescaled to a unit diagonal.
     */
    static double[][] nearestCorrelation(double[][] dense) {
        int n = dense.length;
        EigenDecomposition eigen = new EigenDecomposition(new Array2DRowRealMatrix(dense));
        double[] values = eigen.getRealEigenvalues();
        double[] clipped = new double[n];
        for (int i = 0; i < n; i++) {
            clipped[i] = Math.max(values[i], EIGENVALUE_FLOOR);
        }
        RealMatrix vectors = eigen.getV();
        RealMatrix rebuilt = vectors.multiply(MatrixUtils.createRealDiagonalMatrix(clipped))
                .multiply(vectors.transpose());

        double[][] symmetric = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                symmetric[i][j] = (rebuilt.getEntry(i, j) + rebuilt.getEntry(j, i)) / 2.0;
            }
        }
        double[][] result = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                result[i][j] = i == j ? 1.0 : symmetric[i][j] / Math.sqrt(symmetric[i][i] * symmetric[j][j]);
            }
        }
        return result;
    }

    private static double[][] cholesky(double[][] dense) {
        CholeskyDecomposition decomposition = new CholeskyDecomposition(
                new Array2DRowRealMatrix(dense), SYMMETRY_THRESHOLD, POSITIVITY_THRESHOLD);
        return decomposition.getL().getData();
    }

    private static void correlate(double[][] latents, int[] participants, double[][] lower) {
        int m = participants.length;
        int iterations = latents.length == 0 ? 0 : latents[0].length;
        double[] independent = new double[m];
        for (int i = 0; i < iterations; i++) {
            for (int a = 0; a < m; a++) {
                independent[a] = latents[participants[a]][i];
            }
            for (int a = 0; a < m; a++) {
                double value = 0.0;
                for (int b = 0; b <= a; b++) {
                    value += lower[a][b] * independent[b];
                }
                latents[participants[a]][i] = value;
            }
        }
    }

    private static int[] participantIndices(List<Risk> risks, CorrelationMatrix matrix) {
        Set<String> ids = Set.copyOf(matrix.getRiskIds());
        List<Integer> indices = new ArrayList<>();
        for (int r = 0; r < risks.size(); r++) {
            if (ids.contains(risks.get(r).id())) {
                indices.add(r);
            }
        }
        return indices.stream().mapToInt(Integer::intValue).toArray();
    }

    public record CorrelatedSamples(double[][] samples, boolean adjusted) {
    }

    public record Factorization(double[][] lower, double[][] effective, boolean adjusted) {
    }
}
