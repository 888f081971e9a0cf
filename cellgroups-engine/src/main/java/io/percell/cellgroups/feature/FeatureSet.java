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

package io.percell.cellgroups.feature;

import java.util.List;

/// Result of extracting features from one directory of cell images.
///
/// @param samples readable samples in lexicographic file order
/// @param unreadableCount files that could not be decoded
/// @param zeroCount samples whose feature is exactly zero
/// @param nonZeroCount samples whose feature is non-zero
public record FeatureSet(
    List<CellSample> samples,
    int unreadableCount,
    int zeroCount,
    int nonZeroCount
) {

    public FeatureSet {
        samples = List.copyOf(samples);
    }

    /// Builds a feature set, counting zero and non-zero features.
    public static FeatureSet of(List<CellSample> samples, int unreadableCount) {
        int zero = 0;
        for (CellSample sample : samples) {
            if (sample.feature() == 0.0) {
                zero++;
            }
        }
        return new FeatureSet(samples, unreadableCount, zero, samples.size() - zero);
    }

    public int size() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    /// Feature values in sample order.
    public double[] features() {
        double[] values = new double[samples.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = samples.get(i).feature();
        }
        return values;
    }

    public double min() {
        double min = Double.POSITIVE_INFINITY;
        for (CellSample sample : samples) {
            min = Math.min(min, sample.feature());
        }
        return samples.isEmpty() ? 0.0 : min;
    }

    public double max() {
        double max = Double.NEGATIVE_INFINITY;
        for (CellSample sample : samples) {
            max = Math.max(max, sample.feature());
        }
        return samples.isEmpty() ? 0.0 : max;
    }

    public double range() {
        return max() - min();
    }

    public boolean allZero() {
        return nonZeroCount == 0;
    }
}
