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

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/// Deterministic partition of values into contiguous rank runs.
///
/// Values are stably sorted ascending and cut into `k` runs of `n / k`
/// members; the first `n % k` runs take one extra member. The run index is
/// the label, so equal values are split purely by their input order.
public final class QuantilePartitioner {

    private QuantilePartitioner() {
    }

    /// Labels each value with its run index.
    ///
    /// @param values the values to partition
    /// @param k number of runs, at least 1 and at most `values.length`
    /// @return one label in `[0, k)` per input value
    public static int[] partition(double[] values, int k) {
        int n = values.length;
        if (k < 1 || k > Math.max(n, 1)) {
            throw new IllegalArgumentException("k must be in [1, " + n + "], got " + k);
        }
        int[] labels = new int[n];
        Integer[] order = sortedOrder(values);
        int base = n / k;
        int extra = n % k;
        int position = 0;
        for (int run = 0; run < k; run++) {
            int size = base + (run < extra ? 1 : 0);
            for (int i = 0; i < size; i++) {
                labels[order[position++]] = run;
            }
        }
        return labels;
    }

    /// Means of the `k` runs of a partition, used to seed the clusterers.
    public static double[] runMeans(double[] values, int k) {
        int[] labels = partition(values, k);
        double[] sums = new double[k];
        int[] counts = new int[k];
        for (int i = 0; i < values.length; i++) {
            sums[labels[i]] += values[i];
            counts[labels[i]]++;
        }
        double[] means = new double[k];
        for (int c = 0; c < k; c++) {
            means[c] = counts[c] > 0 ? sums[c] / counts[c] : 0.0;
        }
        return means;
    }

    // Arrays.sort on objects is stable
    private static Integer[] sortedOrder(double[] values) {
        Integer[] order = IntStream.range(0, values.length).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble(i -> values[i]));
        return order;
    }
}
