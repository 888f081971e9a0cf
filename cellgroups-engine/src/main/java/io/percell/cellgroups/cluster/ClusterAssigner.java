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

import io.percell.cellgroups.config.GroupingConfig;
import io.percell.cellgroups.feature.CellSample;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Assigns a raw cluster label to every cell from its scalar feature.
///
/// ## Fallback chain
///
/// - Degenerate input (all zero, or a feature range below the equality
///   epsilon) goes straight to the deterministic quantile partition.
/// - `gmm` fits a Gaussian mixture. One distinct cluster, or fewer clusters
///   than bins while redistribution is forced, falls through to K-Means.
/// - K-Means producing fewer clusters than bins while redistribution is
///   forced falls through to the quantile partition.
///
/// The bin count is first limited to the number of samples. Features are
/// clustered on a log1p scale when that is enabled and every feature is
/// positive.
public class ClusterAssigner {

    private static final Logger logger = LogManager.getLogger(ClusterAssigner.class);

    private final GroupingConfig config;

    public ClusterAssigner(GroupingConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /// Clusters the samples with the configured bin count and records each
    /// sample's raw label on it.
    public ClusterResult assign(List<CellSample> samples) {
        return assign(samples, config.getBins());
    }

    /// Clusters the samples into at most `requestedBins` clusters and records
    /// each sample's raw label on it.
    public ClusterResult assign(List<CellSample> samples, int requestedBins) {
        List<String> ids = new ArrayList<>(samples.size());
        double[] features = new double[samples.size()];
        for (int i = 0; i < features.length; i++) {
            ids.add(samples.get(i).id());
            features[i] = samples.get(i).feature();
        }
        ClusterResult result = assign(ids, features, requestedBins);
        for (int i = 0; i < features.length; i++) {
            samples.get(i).assignRawLabel(result.label(i));
        }
        return result;
    }

    /// Clusters bare feature values.
    ///
    /// @param ids one id per feature
    /// @param features untransformed features
    /// @param requestedBins requested bin count, at least 1
    /// @return the raw assignment
    public ClusterResult assign(List<String> ids, double[] features, int requestedBins) {
        if (features.length == 0) {
            throw new IllegalArgumentException("cannot cluster an empty feature set");
        }
        if (requestedBins < 1) {
            throw new IllegalArgumentException("requested bins must be at least 1, got " + requestedBins);
        }
        int n = features.length;
        int k = Math.min(requestedBins, n);
        if (k < requestedBins) {
            logger.warn("Reducing bins from {} to {} due to limited samples", requestedBins, k);
        }

        if (isDegenerate(features, config.getEqualityEpsilon())) {
            logger.warn("All {} features are zero or nearly identical, distributing cells evenly over {} bins", n, k);
            return quantile(ids, features, requestedBins, k);
        }
        if (k == 1) {
            return new ClusterResult(new int[n], ids, features, config.getMethod(), true, requestedBins, k);
        }

        double[] clustered = prepare(features, config.isLogTransform());
        boolean force = config.isForceRedistribute();

        if (config.getMethod() == ClusterMethod.GMM) {
            GaussianMixtureClusterer gmm = new GaussianMixtureClusterer(k, config.getInitializations(),
                config.getMaxIterations(), config.getCovarianceRegularization(),
                config.getConvergenceTolerance(), config.getSeed());
            GaussianMixtureClusterer.MixtureResult fit = gmm.fit(clustered);
            int distinct = fit.distinctComponents();
            if (!fit.converged()) {
                logger.warn("GMM did not converge after {} iterations", fit.iterations());
            }
            if (distinct == 1 || (force && distinct < k)) {
                logger.info("GMM produced {} distinct clusters for {} bins, falling back to K-Means", distinct, k);
            } else {
                if (distinct < k) {
                    logger.warn("GMM produced only {} distinct clusters for {} bins", distinct, k);
                }
                return new ClusterResult(fit.hardAssignments(), ids, features, ClusterMethod.GMM,
                    fit.converged(), requestedBins, k);
            }
        }

        KMeansClusterer kmeans = new KMeansClusterer(k, config.getInitializations(),
            config.getMaxIterations(), config.getSeed());
        KMeansClusterer.KMeansResult fit = kmeans.fit(clustered);
        int distinct = fit.distinctClusters();
        if (distinct < k) {
            if (force) {
                logger.info("K-Means produced {} distinct clusters for {} bins, forcing quantile redistribution",
                    distinct, k);
                return quantile(ids, features, requestedBins, k);
            }
            logger.warn("K-Means produced only {} distinct clusters for {} bins", distinct, k);
        }
        return new ClusterResult(fit.labels(), ids, features, ClusterMethod.KMEANS, fit.converged(),
            requestedBins, k);
    }

    private static ClusterResult quantile(List<String> ids, double[] features, int requestedBins, int k) {
        int[] labels = QuantilePartitioner.partition(features, k);
        return new ClusterResult(labels, ids, features, ClusterMethod.FORCED_QUANTILE, true, requestedBins, k);
    }

    /// True when every feature is zero or the feature range is below `epsilon`.
    public static boolean isDegenerate(double[] features, double epsilon) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        boolean allZero = true;
        for (double f : features) {
            min = Math.min(min, f);
            max = Math.max(max, f);
            allZero &= f == 0.0;
        }
        return allZero || max - min < epsilon;
    }

    /// Returns the values clustering operates on: log1p of the features when
    /// enabled and all features are positive, otherwise the features as given.
    public static double[] prepare(double[] features, boolean logTransform) {
        boolean allPositive = true;
        for (double f : features) {
            allPositive &= f > 0.0;
        }
        double[] out = new double[features.length];
        for (int i = 0; i < features.length; i++) {
            out[i] = logTransform && allPositive ? Math.log1p(features[i]) : features[i];
        }
        return out;
    }
}
