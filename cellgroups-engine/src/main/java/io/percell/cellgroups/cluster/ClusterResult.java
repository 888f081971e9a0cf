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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/// Raw cluster assignment for one population of cells.
///
/// Raw labels are whatever the producing method chose; they carry no order.
/// Means are always computed on the untransformed features.
public final class ClusterResult {

    private final int[] labels;
    private final ClusterMethod method;
    private final boolean converged;
    private final int requestedBins;
    private final int actualBins;
    private final SortedMap<Integer, List<String>> members;
    private final SortedMap<Integer, Double> means;

    /// Creates a result and derives members and means per raw label.
    ///
    /// @param labels raw label per sample
    /// @param sampleIds sample ids, parallel to `labels`
    /// @param features untransformed features, parallel to `labels`
    /// @param method method that produced the labels
    /// @param converged whether that method converged
    /// @param requestedBins bin count asked for
    /// @param actualBins bin count after limiting to the sample count
    public ClusterResult(int[] labels, List<String> sampleIds, double[] features, ClusterMethod method,
                         boolean converged, int requestedBins, int actualBins) {
        if (labels.length != sampleIds.size() || labels.length != features.length) {
            throw new IllegalArgumentException("labels, ids and features must have the same length");
        }
        this.labels = Arrays.copyOf(labels, labels.length);
        this.method = Objects.requireNonNull(method, "method");
        this.converged = converged;
        this.requestedBins = requestedBins;
        this.actualBins = actualBins;

        SortedMap<Integer, List<String>> byLabel = new TreeMap<>();
        SortedMap<Integer, double[]> sums = new TreeMap<>();
        for (int i = 0; i < labels.length; i++) {
            byLabel.computeIfAbsent(labels[i], l -> new ArrayList<>()).add(sampleIds.get(i));
            double[] acc = sums.computeIfAbsent(labels[i], l -> new double[2]);
            acc[0] += features[i];
            acc[1]++;
        }
        SortedMap<Integer, List<String>> frozen = new TreeMap<>();
        byLabel.forEach((label, ids) -> frozen.put(label, Collections.unmodifiableList(ids)));
        this.members = Collections.unmodifiableSortedMap(frozen);
        SortedMap<Integer, Double> meanByLabel = new TreeMap<>();
        sums.forEach((label, acc) -> meanByLabel.put(label, acc[0] / acc[1]));
        this.means = Collections.unmodifiableSortedMap(meanByLabel);
    }

    /// Raw label per sample, in sample order.
    public int[] labels() {
        return Arrays.copyOf(labels, labels.length);
    }

    public int label(int sampleIndex) {
        return labels[sampleIndex];
    }

    /// Sample ids per non-empty raw label.
    public SortedMap<Integer, List<String>> members() {
        return members;
    }

    /// Mean untransformed feature per non-empty raw label.
    public SortedMap<Integer, Double> means() {
        return means;
    }

    public ClusterMethod method() {
        return method;
    }

    public boolean converged() {
        return converged;
    }

    public int requestedBins() {
        return requestedBins;
    }

    public int actualBins() {
        return actualBins;
    }

    /// Number of raw labels with at least one member.
    public int distinctClusters() {
        return members.size();
    }

    public int sampleCount() {
        return labels.length;
    }

    @Override
    public String toString() {
        return "ClusterResult[method=" + method + ", converged=" + converged + ", bins=" + actualBins
            + "/" + requestedBins + ", clusters=" + distinctClusters() + "]";
    }
}
