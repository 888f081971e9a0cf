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

package io.percell.cellgroups.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.percell.cellgroups.cluster.ClusterMethod;
import io.percell.cellgroups.feature.CellMetric;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Settings for one grouping run. Every field has a default, so a JSON file
 * only needs the keys it wants to change.
 *
 * <pre>{@code
 * {
 *   "bins": 4,
 *   "method": "kmeans",
 *   "force_redistribute": true
 * }
 * }</pre>
 */
public class GroupingConfig {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    public static final int DEFAULT_BINS = 5;
    public static final String DEFAULT_CELL_FILE_PATTERN = "CELL*.tif";

    /** Requested number of intensity bins */
    @SerializedName("bins")
    private int bins = DEFAULT_BINS;

    /** Primary clustering method, gmm or kmeans */
    @SerializedName("method")
    private String method = ClusterMethod.GMM.label();

    /** Per-cell feature, one of auc, max, mean, sg */
    @SerializedName("metric")
    private String metric = CellMetric.AUC.label();

    @SerializedName("force_redistribute")
    private boolean forceRedistribute = false;

    @SerializedName("seed")
    private long seed = 0L;

    /** Choose the bin count by BIC instead of using {@code bins} */
    @SerializedName("auto_bins")
    private boolean autoBins = false;

    /** Upper bound of the BIC sweep */
    @SerializedName("max_clusters")
    private int maxClusters = 10;

    @SerializedName("initializations")
    private int initializations = 10;

    @SerializedName("max_iterations")
    private int maxIterations = 300;

    @SerializedName("covariance_regularization")
    private double covarianceRegularization = 1e-4;

    @SerializedName("convergence_tolerance")
    private double convergenceTolerance = 1e-3;

    /** Cluster on log1p of the features when all of them are positive */
    @SerializedName("log_transform")
    private boolean logTransform = true;

    /** Feature ranges below this count as all-identical */
    @SerializedName("equality_epsilon")
    private double equalityEpsilon = 1e-6;

    @SerializedName("cell_file_pattern")
    private String cellFilePattern = DEFAULT_CELL_FILE_PATTERN;

    public GroupingConfig() {
    }

    public int getBins() {
        return bins;
    }

    public GroupingConfig setBins(int bins) {
        this.bins = bins;
        return this;
    }

    public ClusterMethod getMethod() {
        return ClusterMethod.fromName(method);
    }

    public GroupingConfig setMethod(ClusterMethod method) {
        if (method == ClusterMethod.FORCED_QUANTILE) {
            throw new IllegalArgumentException("forced_quantile is a fallback and cannot be requested");
        }
        this.method = method.label();
        return this;
    }

    public CellMetric getMetric() {
        return CellMetric.fromName(metric);
    }

    public GroupingConfig setMetric(CellMetric metric) {
        this.metric = metric.label();
        return this;
    }

    public boolean isForceRedistribute() {
        return forceRedistribute;
    }

    public GroupingConfig setForceRedistribute(boolean forceRedistribute) {
        this.forceRedistribute = forceRedistribute;
        return this;
    }

    public long getSeed() {
        return seed;
    }

    public GroupingConfig setSeed(long seed) {
        this.seed = seed;
        return this;
    }

    public boolean isAutoBins() {
        return autoBins;
    }

    public GroupingConfig setAutoBins(boolean autoBins) {
        this.autoBins = autoBins;
        return this;
    }

    public int getMaxClusters() {
        return maxClusters;
    }

    public GroupingConfig setMaxClusters(int maxClusters) {
        this.maxClusters = maxClusters;
        return this;
    }

    public int getInitializations() {
        return initializations;
    }

    public GroupingConfig setInitializations(int initializations) {
        this.initializations = initializations;
        return this;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public GroupingConfig setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
        return this;
    }

    public double getCovarianceRegularization() {
        return covarianceRegularization;
    }

    public GroupingConfig setCovarianceRegularization(double covarianceRegularization) {
        this.covarianceRegularization = covarianceRegularization;
        return this;
    }

    public double getConvergenceTolerance() {
        return convergenceTolerance;
    }

    public GroupingConfig setConvergenceTolerance(double convergenceTolerance) {
        this.convergenceTolerance = convergenceTolerance;
        return this;
    }

    public boolean isLogTransform() {
        return logTransform;
    }

    public GroupingConfig setLogTransform(boolean logTransform) {
        this.logTransform = logTransform;
        return this;
    }

    public double getEqualityEpsilon() {
        return equalityEpsilon;
    }

    public GroupingConfig setEqualityEpsilon(double equalityEpsilon) {
        this.equalityEpsilon = equalityEpsilon;
        return this;
    }

    public String getCellFilePattern() {
        return cellFilePattern;
    }

    public GroupingConfig setCellFilePattern(String cellFilePattern) {
        this.cellFilePattern = cellFilePattern;
        return this;
    }

    /**
     * Checks every setting and resolves the method and metric names.
     *
     * @return this configuration
     * @throws IllegalArgumentException naming the first invalid setting
     */
    public GroupingConfig validate() {
        if (bins < 1) {
            throw new IllegalArgumentException("bins must be at least 1, got " + bins);
        }
        getMethod();
        getMetric();
        if (maxClusters < 1) {
            throw new IllegalArgumentException("max_clusters must be at least 1, got " + maxClusters);
        }
        if (initializations < 1) {
            throw new IllegalArgumentException("initializations must be at least 1, got " + initializations);
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("max_iterations must be at least 1, got " + maxIterations);
        }
        if (!(covarianceRegularization > 0)) {
            throw new IllegalArgumentException("covariance_regularization must be positive");
        }
        if (!(convergenceTolerance > 0)) {
            throw new IllegalArgumentException("convergence_tolerance must be positive");
        }
        if (!(equalityEpsilon >= 0)) {
            throw new IllegalArgumentException("equality_epsilon must not be negative");
        }
        if (cellFilePattern == null || cellFilePattern.isBlank()) {
            throw new IllegalArgumentException("cell_file_pattern must not be empty");
        }
        return this;
    }

    /**
     * Returns an independent copy of this configuration.
     */
    public GroupingConfig copy() {
        return GSON.fromJson(GSON.toJson(this), GroupingConfig.class);
    }

    public static GroupingConfig fromJson(String json) {
        GroupingConfig config = GSON.fromJson(json, GroupingConfig.class);
        return config != null ? config : new GroupingConfig();
    }

    public static GroupingConfig fromJson(Reader reader) {
        GroupingConfig config = GSON.fromJson(reader, GroupingConfig.class);
        return config != null ? config : new GroupingConfig();
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    public void toJson(Writer writer) {
        GSON.toJson(this, writer);
    }

    /**
     * Loads and validates a configuration file.
     *
     * @param path JSON file to read
     * @return the validated configuration
     * @throws IOException if the file cannot be read or is not valid JSON
     * @throws IllegalArgumentException if a setting is out of range
     */
    public static GroupingConfig loadFromFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromJson(reader).validate();
        } catch (JsonParseException e) {
            throw new IOException("Invalid grouping config " + path + ": " + e.getMessage(), e);
        }
    }

    public void saveToFile(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            toJson(writer);
        }
    }

    @Override
    public String toString() {
        return "GroupingConfig{bins=" + bins + ", method=" + method + ", metric=" + metric
            + ", forceRedistribute=" + forceRedistribute + ", autoBins=" + autoBins
            + ", seed=" + seed + "}";
    }
}
