/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.percell.cellgroups.cluster;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Locale;

/// Expectation-Maximization fitting of a one-dimensional Gaussian mixture.
///
/// ## Algorithm
///
/// Each initialization picks starting centers (a quantile split first, then
/// seeded k-means++), refines them with K-Means, and derives the starting
/// weights, means and variances from the resulting hard partition. EM then
/// alternates:
///
/// 1. **E-step**: responsibilities in log space,
///    ```
///    log r_{ik} = log w_k + log N(x_i | μ_k, σ²_k) - logsumexp_j(...)
///    ```
/// 2. **M-step**:
///    ```
///    N_k  = Σ_i r_{ik}
///    μ_k  = Σ_i r_{ik} x_i / N_k
///    σ²_k = Σ_i r_{ik} (x_i - μ_k)² / N_k + reg
///    w_k  = N_k / N
///    ```
///
/// ## Convergence
///
/// EM stops when the per-sample mean log-likelihood changes by less than the
/// tolerance, or after the iteration cap. A final E-step aligns the returned
/// responsibilities with the returned parameters. The initialization with the
/// highest final log-likelihood wins.
///
/// This class is NOT thread-safe.
public final class GaussianMixtureClusterer {

    private static final Logger logger = LogManager.getLogger(GaussianMixtureClusterer.class);

    public static final int DEFAULT_INITIALIZATIONS = 10;
    public static final int DEFAULT_MAX_ITERATIONS = 300;
    public static final double DEFAULT_REGULARIZATION = 1e-4;
    public static final double DEFAULT_TOLERANCE = 1e-3;

    private static final double LOG_2PI = Math.log(2.0 * Math.PI);

    /// Keeps component masses off zero
    private static final double MIN_MASS = 10 * Math.ulp(1.0);

    private final int numComponents;
    private final int initializations;
    private final int maxIterations;
    private final double regularization;
    private final double tolerance;
    private final long seed;

    public GaussianMixtureClusterer(int numComponents, long seed) {
        this(numComponents, DEFAULT_INITIALIZATIONS, DEFAULT_MAX_ITERATIONS,
            DEFAULT_REGULARIZATION, DEFAULT_TOLERANCE, seed);
    }

    /// Creates a clusterer with custom parameters.
    ///
    /// @param numComponents mixture components
    /// @param initializations independent starts, the best is kept
    /// @param maxIterations EM iteration cap per start
    /// @param regularization positive constant added to every variance
    /// @param tolerance convergence threshold on the mean log-likelihood
    /// @param seed seed for the k-means++ starts
    public GaussianMixtureClusterer(int numComponents, int initializations, int maxIterations,
                                    double regularization, double tolerance, long seed) {
        if (numComponents < 1) {
            throw new IllegalArgumentException("numComponents must be at least 1, got " + numComponents);
        }
        if (initializations < 1 || maxIterations < 1) {
            throw new IllegalArgumentException("initializations and maxIterations must be at least 1");
        }
        if (regularization <= 0 || tolerance <= 0) {
            throw new IllegalArgumentException("regularization and tolerance must be positive");
        }
        this.numComponents = numComponents;
        this.initializations = initializations;
        this.maxIterations = maxIterations;
        this.regularization = regularization;
        this.tolerance = tolerance;
        this.seed = seed;
    }

    /// Fits the mixture, keeping the best of all initializations.
    ///
    /// @param data values to fit, at least `numComponents` of them
    /// @return the highest-likelihood fit
    public MixtureResult fit(double[] data) {
        if (data == null || data.length < numComponents) {
            throw new IllegalArgumentException("need at least " + numComponents + " values to fit "
                + numComponents + " components");
        }
        double dataVariance = variance(data);
        MixtureResult best = null;
        for (int init = 0; init < initializations; init++) {
            double[] centers = init == 0
                ? QuantilePartitioner.runMeans(data, numComponents)
                : KMeansClusterer.plusPlusCenters(data, numComponents, RandomGenerators.forInitialization(seed, init));
            KMeansClusterer.KMeansResult refined = KMeansClusterer.lloyd(data, centers, maxIterations);
            MixtureResult candidate = runEm(data, refined, dataVariance);
            logger.trace("GMM init {}: logL={} iterations={} converged={}",
                init, candidate.logLikelihood(), candidate.iterations(), candidate.converged());
            if (best == null || candidate.logLikelihood() > best.logLikelihood()) {
                best = candidate;
            }
        }
        if (!best.converged()) {
            logger.debug("GMM with {} components did not converge in {} iterations", numComponents, maxIterations);
        }
        return best;
    }

    private MixtureResult runEm(double[] data, KMeansClusterer.KMeansResult start, double dataVariance) {
        int n = data.length;
        int k = numComponents;
        double[] means = new double[k];
        double[] variances = new double[k];
        double[] weights = new double[k];
        initializeFromPartition(data, start, dataVariance, means, variances, weights);

        double[][] responsibilities = new double[n][k];
        double previous = Double.NEGATIVE_INFINITY;
        boolean converged = false;
        int iteration = 0;
        while (iteration < maxIterations) {
            iteration++;
            double meanLogLikelihood = estep(data, means, variances, weights, responsibilities);
            mstep(data, responsibilities, means, variances, weights);
            if (Math.abs(meanLogLikelihood - previous) < tolerance) {
                converged = true;
                break;
            }
            previous = meanLogLikelihood;
        }
        double finalMean = estep(data, means, variances, weights, responsibilities);
        return new MixtureResult(means, variances, weights, responsibilities, finalMean * n, iteration, converged);
    }

    private void initializeFromPartition(double[] data, KMeansClusterer.KMeansResult start, double dataVariance,
                                         double[] means, double[] variances, double[] weights) {
        int k = means.length;
        int[] labels = start.labels();
        double[] sums = new double[k];
        int[] counts = new int[k];
        for (int i = 0; i < data.length; i++) {
            sums[labels[i]] += data[i];
            counts[labels[i]]++;
        }
        double[] sq = new double[k];
        for (int c = 0; c < k; c++) {
            means[c] = counts[c] > 0 ? sums[c] / counts[c] : start.centroids()[c];
        }
        for (int i = 0; i < data.length; i++) {
            double d = data[i] - means[labels[i]];
            sq[labels[i]] += d * d;
        }
        double totalMass = 0.0;
        for (int c = 0; c < k; c++) {
            if (counts[c] > 0) {
                variances[c] = sq[c] / counts[c] + regularization;
                weights[c] = counts[c];
            } else {
                variances[c] = dataVariance + regularization;
                weights[c] = MIN_MASS;
            }
            totalMass += weights[c];
        }
        for (int c = 0; c < k; c++) {
            weights[c] /= totalMass;
        }
    }

    /// E-step; fills responsibilities and returns the mean log-likelihood.
    private static double estep(double[] data, double[] means, double[] variances, double[] weights,
                                double[][] responsibilities) {
        int k = means.length;
        double[] logTerms = new double[k];
        double total = 0.0;
        for (int i = 0; i < data.length; i++) {
            double max = Double.NEGATIVE_INFINITY;
            for (int c = 0; c < k; c++) {
                logTerms[c] = Math.log(weights[c]) + logDensity(data[i], means[c], variances[c]);
                max = Math.max(max, logTerms[c]);
            }
            double sum = 0.0;
            for (int c = 0; c < k; c++) {
                sum += Math.exp(logTerms[c] - max);
            }
            double logNorm = max + Math.log(sum);
            for (int c = 0; c < k; c++) {
                responsibilities[i][c] = Math.exp(logTerms[c] - logNorm);
            }
            total += logNorm;
        }
        return total / data.length;
    }

    private void mstep(double[] data, double[][] responsibilities,
                       double[] means, double[] variances, double[] weights) {
        int n = data.length;
        int k = means.length;
        for (int c = 0; c < k; c++) {
            double mass = MIN_MASS;
            double weightedSum = 0.0;
            for (int i = 0; i < n; i++) {
                mass += responsibilities[i][c];
                weightedSum += responsibilities[i][c] * data[i];
            }
            double mean = weightedSum / mass;
            double weightedSq = 0.0;
            for (int i = 0; i < n; i++) {
                double d = data[i] - mean;
                weightedSq += responsibilities[i][c] * d * d;
            }
            means[c] = mean;
            variances[c] = weightedSq / mass + regularization;
            weights[c] = mass / n;
        }
    }

    static double logDensity(double x, double mean, double variance) {
        double d = x - mean;
        return -0.5 * (LOG_2PI + Math.log(variance) + d * d / variance);
    }

    static double variance(double[] data) {
        double mean = 0.0;
        for (double v : data) {
            mean += v;
        }
        mean /= data.length;
        double sq = 0.0;
        for (double v : data) {
            sq += (v - mean) * (v - mean);
        }
        return sq / data.length;
    }

    private static int argmax(double[] arr) {
        int maxIdx = 0;
        for (int i = 1; i < arr.length; i++) {
            if (arr[i] > arr[maxIdx]) {
                maxIdx = i;
            }
        }
        return maxIdx;
    }

    /// Result of a mixture fit.
    ///
    /// @param means component means
    /// @param variances component variances, regularizer included
    /// @param weights component weights, summing to 1
    /// @param responsibilities soft assignments, n_samples × n_components
    /// @param logLikelihood total log-likelihood of the data under the fit
    /// @param iterations EM iterations run
    /// @param converged whether the tolerance was reached before the cap
    public record MixtureResult(
        double[] means,
        double[] variances,
        double[] weights,
        double[][] responsibilities,
        double logLikelihood,
        int iterations,
        boolean converged
    ) {
        public int numComponents() {
            return means.length;
        }

        /// Hard assignments by maximum responsibility.
        public int[] hardAssignments() {
            int[] assignments = new int[responsibilities.length];
            for (int i = 0; i < responsibilities.length; i++) {
                assignments[i] = argmax(responsibilities[i]);
            }
            return assignments;
        }

        /// Number of components that win at least one sample.
        public int distinctComponents() {
            return (int) Arrays.stream(hardAssignments()).distinct().count();
        }

        /// Free parameters of a 1-D mixture: k means, k variances, k - 1 weights.
        public int freeParameters() {
            return 3 * means.length - 1;
        }

        /// Bayesian Information Criterion, `-2 logL + p ln n`.
        public double bic() {
            int n = responsibilities.length;
            return -2.0 * logLikelihood + freeParameters() * Math.log(n);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append(String.format(Locale.ROOT, "MixtureResult[k=%d, LL=%.2f, iters=%d, converged=%s]%n",
                means.length, logLikelihood, iterations, converged));
            for (int c = 0; c < means.length; c++) {
                sb.append(String.format(Locale.ROOT, "  Component %d: mean=%.4f, var=%.4f, weight=%.2f%%%n",
                    c, means[c], variances[c], weights[c] * 100));
            }
            return sb.toString();
        }
    }
}
