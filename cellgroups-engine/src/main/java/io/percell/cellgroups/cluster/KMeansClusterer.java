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

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/// One-dimensional K-Means clustering with several seeded initializations.
///
/// ## Initialization
///
/// The first initialization always starts from the means of an equal-size
/// quantile split of the sorted data, which makes the common case independent
/// of the seed. The remaining initializations use k-means++ seeding from
/// generators derived from the run seed.
///
/// ## Iteration
///
/// Lloyd iterations alternate nearest-centroid assignment (ties go to the
/// lower index) with centroid recomputation. A centroid left without members
/// keeps its previous position. Iteration stops once no assignment changes.
///
/// The initialization with the lowest inertia wins; a later one replaces an
/// earlier one only when it is strictly better.
///
/// This class is NOT thread-safe.
public final class KMeansClusterer {

    private static final Logger logger = LogManager.getLogger(KMeansClusterer.class);

    public static final int DEFAULT_INITIALIZATIONS = 10;
    public static final int DEFAULT_MAX_ITERATIONS = 300;

    private final int numClusters;
    private final int initializations;
    private final int maxIterations;
    private final long seed;

    public KMeansClusterer(int numClusters, long seed) {
        this(numClusters, DEFAULT_INITIALIZATIONS, DEFAULT_MAX_ITERATIONS, seed);
    }

    public KMeansClusterer(int numClusters, int initializations, int maxIterations, long seed) {
        if (numClusters < 1) {
            throw new IllegalArgumentException("numClusters must be at least 1, got " + numClusters);
        }
        if (initializations < 1) {
            throw new IllegalArgumentException("initializations must be at least 1, got " + initializations);
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        }
        this.numClusters = numClusters;
        this.initializations = initializations;
        this.maxIterations = maxIterations;
        this.seed = seed;
    }

    /// Clusters the data, keeping the best of all initializations.
    ///
    /// @param data values to cluster, at least `numClusters` of them
    /// @return the lowest-inertia result
    public KMeansResult fit(double[] data) {
        if (data == null || data.length < numClusters) {
            throw new IllegalArgumentException("need at least " + numClusters + " values to form "
                + numClusters + " clusters");
        }
        KMeansResult best = null;
        for (int init = 0; init < initializations; init++) {
            double[] centers = init == 0
                ? QuantilePartitioner.runMeans(data, numClusters)
                : plusPlusCenters(data, numClusters, RandomGenerators.forInitialization(seed, init));
            KMeansResult candidate = lloyd(data, centers, maxIterations);
            logger.trace("k-means init {}: inertia={} iterations={}", init, candidate.inertia(), candidate.iterations());
            if (best == null || candidate.inertia() < best.inertia()) {
                best = candidate;
            }
        }
        return best;
    }

    /// Runs Lloyd iterations from the given starting centroids.
    ///
    /// @param data values to cluster
    /// @param initialCenters starting centroids, one per cluster
    /// @param maxIterations iteration cap
    /// @return the refined clustering
    public static KMeansResult lloyd(double[] data, double[] initialCenters, int maxIterations) {
        int k = initialCenters.length;
        double[] centers = Arrays.copyOf(initialCenters, k);
        int[] labels = new int[data.length];
        Arrays.fill(labels, -1);

        boolean converged = false;
        int iteration = 0;
        while (iteration < maxIterations) {
            iteration++;
            boolean changed = false;
            for (int i = 0; i < data.length; i++) {
                int nearest = nearest(centers, data[i]);
                if (nearest != labels[i]) {
                    labels[i] = nearest;
                    changed = true;
                }
            }
            if (!changed) {
                converged = true;
                break;
            }
            double[] sums = new double[k];
            int[] counts = new int[k];
            for (int i = 0; i < data.length; i++) {
                sums[labels[i]] += data[i];
                counts[labels[i]]++;
            }
            for (int c = 0; c < k; c++) {
                if (counts[c] > 0) {
                    centers[c] = sums[c] / counts[c];
                }
            }
        }

        double inertia = 0.0;
        for (int i = 0; i < data.length; i++) {
            double d = data[i] - centers[labels[i]];
            inertia += d * d;
        }
        return new KMeansResult(labels, centers, inertia, iteration, converged);
    }

    /// k-means++ seeding: the first center is uniform over the data, each
    /// further one is drawn with probability proportional to its squared
    /// distance from the closest center chosen so far.
    static double[] plusPlusCenters(double[] data, int k, UniformRandomProvider rng) {
        double[] centers = new double[k];
        centers[0] = data[rng.nextInt(data.length)];
        double[] distances = new double[data.length];
        for (int c = 1; c < k; c++) {
            double total = 0.0;
            for (int i = 0; i < data.length; i++) {
                double best = Double.POSITIVE_INFINITY;
                for (int j = 0; j < c; j++) {
                    double d = data[i] - centers[j];
                    best = Math.min(best, d * d);
                }
                distances[i] = best;
                total += best;
            }
            if (total <= 0.0) {
                centers[c] = data[rng.nextInt(data.length)];
                continue;
            }
            double target = rng.nextDouble() * total;
            int chosen = data.length - 1;
            double cumulative = 0.0;
            for (int i = 0; i < data.length; i++) {
                cumulative += distances[i];
                if (cumulative > target) {
                    chosen = i;
                    break;
                }
            }
            centers[c] = data[chosen];
        }
        return centers;
    }

    static int nearest(double[] centers, double x) {
        int nearest = 0;
        double best = Math.abs(x - centers[0]);
        for (int c = 1; c < centers.length; c++) {
            double d = Math.abs(x - centers[c]);
            if (d < best) {
                best = d;
                nearest = c;
            }
        }
        return nearest;
    }

    /// Result of K-Means clustering.
    ///
    /// @param labels cluster index per value
    /// @param centroids final centroid per cluster
    /// @param inertia sum of squared distances to the assigned centroids
    /// @param iterations Lloyd iterations run
    /// @param converged whether assignments stabilized before the cap
    public record KMeansResult(
        int[] labels,
        double[] centroids,
        double inertia,
        int iterations,
        boolean converged
    ) {
        /// Number of clusters that received at least one value.
        public int distinctClusters() {
            return (int) Arrays.stream(labels).distinct().count();
        }
    }
}
